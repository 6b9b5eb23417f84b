package qrlab.render;

import java.util.Optional;

/**
 * Either a rendered image or the reason there is none.
 */
public final class RenderResult {

    private final RenderedQr image;
    private final RenderFailure failure;

    private RenderResult(RenderedQr image, RenderFailure failure) {
        this.image = image;
        this.failure = failure;
    }

    public static RenderResult success(RenderedQr image) {
        return new RenderResult(image, null);
    }

    public static RenderResult failure(RenderFailure.Reason reason, String message) {
        return new RenderResult(null, new RenderFailure(reason, message));
    }

    public boolean isSuccess() {
        return image != null;
    }

    public Optional<RenderedQr> image() {
        return Optional.ofNullable(image);
    }

    public Optional<RenderFailure> failure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return isSuccess() ? "RenderResult[success " + image.metadata() + "]" : "RenderResult[" + failure + "]";
    }
}
