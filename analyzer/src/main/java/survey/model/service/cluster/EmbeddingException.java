package survey.model.service.cluster;

public class EmbeddingException extends RuntimeException {
    public EmbeddingException(String message) { super(message); }

    public EmbeddingException(String message, Throwable cause) { super(message, cause); }
}
