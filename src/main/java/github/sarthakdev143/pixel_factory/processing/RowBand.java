package github.sarthakdev143.pixel_factory.processing;

public record RowBand(int startY, int endY) {

    public RowBand {
        if (startY < 0 || endY <= startY) {
            throw new IllegalArgumentException("Row band must be non-empty: [" + startY + ", " + endY + ")");
        }
    }

    public int rows() {
        return endY - startY;
    }
}
