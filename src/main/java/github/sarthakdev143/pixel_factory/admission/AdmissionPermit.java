package github.sarthakdev143.pixel_factory.admission;

public interface AdmissionPermit extends AutoCloseable {

    @Override
    void close();
}
