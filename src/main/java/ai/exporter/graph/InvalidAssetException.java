package ai.exporter.graph;

/**
 * The asset handed to the encoder is absent or unusable.
 */
public class InvalidAssetException extends RuntimeException {

    public InvalidAssetException(String message) {
        super(message);
    }
}
