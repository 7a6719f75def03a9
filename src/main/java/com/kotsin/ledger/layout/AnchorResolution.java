package com.kotsin.ledger.layout;

import com.kotsin.ledger.error.LayoutException;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of an anchor search: either an {@link Anchor} or the reason none was found.
 */
public final class AnchorResolution {

    private final Anchor anchor;
    private final String failure;

    private AnchorResolution(Anchor anchor, String failure) {
        this.anchor = anchor;
        this.failure = failure;
    }

    public static AnchorResolution found(Anchor anchor) {
        return new AnchorResolution(Objects.requireNonNull(anchor), null);
    }

    public static AnchorResolution notFound(String reason) {
        return new AnchorResolution(null, reason);
    }

    public boolean isFound() {
        return anchor != null;
    }

    public Optional<Anchor> anchor() {
        return Optional.ofNullable(anchor);
    }

    public String failure() {
        return failure;
    }

    public Anchor orElseThrow() {
        if (anchor == null) {
            throw new LayoutException(failure);
        }
        return anchor;
    }

    @Override
    public String toString() {
        return isFound() ? "found(" + anchor + ")" : "notFound(" + failure + ")";
    }
}
