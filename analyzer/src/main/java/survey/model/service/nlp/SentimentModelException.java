package survey.model.service.nlp;

public class SentimentModelException extends RuntimeException {
    public SentimentModelException(String message) { super(message); }

    public SentimentModelException(String message, Throwable cause) { super(message, cause); }
}
