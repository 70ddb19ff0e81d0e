package uk.gegc.reviewscheduler.shared.api.problem;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;

import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent assembly of {@link ProblemDetail} bodies for a {@link ProblemType}.
 * Every body carries the request path as {@code instance} and a {@code timestamp} property.
 */
public final class ProblemDetailBuilder {

    private final ProblemType type;
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private String detail;
    private String path;

    private ProblemDetailBuilder(ProblemType type) {
        this.type = type;
    }

    public static ProblemDetailBuilder of(ProblemType type) {
        return new ProblemDetailBuilder(type);
    }

    public ProblemDetailBuilder detail(String detail) {
        this.detail = detail;
        return this;
    }

    public ProblemDetailBuilder at(HttpServletRequest request) {
        this.path = request == null ? null : request.getRequestURI();
        return this;
    }

    /**
     * The {@code ResponseEntityExceptionHandler} callbacks only see a {@link WebRequest}.
     */
    public ProblemDetailBuilder at(WebRequest request) {
        if (request instanceof ServletWebRequest servletRequest) {
            return at(servletRequest.getRequest());
        }
        return this;
    }

    public ProblemDetailBuilder property(String name, Object value) {
        properties.put(name, value);
        return this;
    }

    public ProblemDetail build() {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(type.status(), detail);
        problem.setType(type.uri());
        problem.setTitle(type.title());
        if (path != null) {
            problem.setInstance(URI.create(path));
        }
        problem.setProperty("timestamp", Instant.now());
        properties.forEach(problem::setProperty);
        return problem;
    }

    public ResponseEntity<ProblemDetail> toResponse() {
        return ResponseEntity.status(type.status()).body(build());
    }
}
