package com.skein.ingest;

import com.skein.model.CommitFrame;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Either an accepted {@link CommitFrame} or the reason the message was dropped.
 * Rejections keep the relay sequence (when the message had one) so the cursor can
 * move past them.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class FilterResult {

    private final CommitFrame frame;
    private final RejectionReason reason;
    private final String detail;
    private final Long sequence;

    public static FilterResult accepted(CommitFrame frame) {
        return new FilterResult(frame, null, null, frame.getSequence());
    }

    public static FilterResult rejected(RejectionReason reason, String detail, Long sequence) {
        return new FilterResult(null, reason, detail, sequence);
    }

    public boolean isAccepted() {
        return frame != null;
    }

    @Override
    public String toString() {
        return isAccepted()
                ? "accepted(" + frame.describe() + ")"
                : "rejected(" + reason + ": " + detail + ")";
    }
}
