package github.sarthakdev143.pixel_factory.service;

public class ScriptExecutionException extends Exception {

    public ScriptExecutionException(String message) {
        super(message);
    }

    public ScriptExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
