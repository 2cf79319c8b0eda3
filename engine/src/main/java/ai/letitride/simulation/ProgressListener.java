package ai.letitride.simulation;

/**
 * Receives progress as units finish. Called from worker threads; {@code completed} values may
 * arrive out of order.
 */
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = (completed, total) -> { };

    void onProgress(int completed, int total);
}
