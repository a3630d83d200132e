package eu.fbk.slopat.store;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

/**
 * The outcome of a write operation on a {@link GraphStore}: whether it succeeded, how many
 * statements were written or skipped as malformed, and the error message on failure.
 */
public final class WriteResult {

    private final boolean success;

    private final int inserted;

    private final int skipped;

    @Nullable
    private final String error;

    private WriteResult(final boolean success, final int inserted, final int skipped,
            @Nullable final String error) {
        this.success = success;
        this.inserted = inserted;
        this.skipped = skipped;
        this.error = error;
    }

    static WriteResult success(final int inserted, final int skipped) {
        return new WriteResult(true, inserted, skipped, null);
    }

    static WriteResult failure(final String error, final int skipped) {
        return new WriteResult(false, 0, skipped, error);
    }

    public boolean isSuccess() {
        return this.success;
    }

    public int getInserted() {
        return this.inserted;
    }

    public int getSkipped() {
        return this.skipped;
    }

    @Nullable
    public String getError() {
        return this.error;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("success", this.success)
                .add("inserted", this.inserted).add("skipped", this.skipped)
                .add("error", this.error).toString();
    }

}
