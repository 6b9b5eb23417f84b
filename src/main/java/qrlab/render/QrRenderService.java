package qrlab.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qrlab.CapacityExceededException;
import qrlab.ImageReadException;
import qrlab.InvalidInputException;

import java.util.Map;

/**
 * Validate-then-render entry point for untrusted styling options. Never throws, every problem comes back
 * as a {@link RenderFailure}.
 */
public class QrRenderService {
    private static final Logger log = LoggerFactory.getLogger(QrRenderService.class);

    private final QrStyleValidator validator;
    private final QrRenderEngine engine;

    public QrRenderService(QrStyleValidator validator, QrRenderEngine engine) {
        this.validator = validator;
        this.engine = engine;
    }

    public QrRenderService() {
        this(new QrStyleValidator(), new QrRenderEngine());
    }

    public RenderResult render(Map<String, ?> options) {
        QrRenderRequest request;
        try {
            request = validator.validate(options);
        } catch (InvalidInputException e) {
            log.info("rejected render request: {}", e.getMessage());
            return RenderResult.failure(RenderFailure.Reason.INVALID_INPUT, e.getMessage());
        }
        return render(request);
    }

    public RenderResult render(QrRenderRequest request) {
        try {
            return RenderResult.success(engine.render(request));
        } catch (CapacityExceededException e) {
            log.info("{} ({} chars)", e.getMessage(), request.data().length());
            return RenderResult.failure(RenderFailure.Reason.CAPACITY_EXCEEDED, e.getMessage());
        } catch (ImageReadException e) {
            log.info("render failed: {}", e.getMessage());
            return RenderResult.failure(RenderFailure.Reason.IMAGE_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            log.error("render failed", e);
            return RenderResult.failure(RenderFailure.Reason.INTERNAL, String.valueOf(e.getMessage()));
        }
    }

    public Map<String, Object> availableStyles() {
        return validator.availableStyles();
    }
}
