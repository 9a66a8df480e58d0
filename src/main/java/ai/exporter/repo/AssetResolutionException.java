package ai.exporter.repo;

public class AssetResolutionException extends Exception {

    public AssetResolutionException(String message) {
        super(message);
    }

    public AssetResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
