package ch.so.arp.rag.text2sql.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import ch.so.arp.rag.text2sql.Text2SqlException;
import ch.so.arp.rag.text2sql.generation.LlmServiceException;
import ch.so.arp.rag.text2sql.knowledge.EmbeddingServiceException;
import ch.so.arp.rag.text2sql.knowledge.KnowledgeBaseException;
import ch.so.arp.rag.text2sql.metadata.ExtractionException;
import jakarta.validation.ConstraintViolationException;

/**
 * Maps service failures to RFC 7807 problem responses. Request body
 * validation errors are handled by the base class.
 */
@RestControllerAdvice
public class ApiExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({ IllegalArgumentException.class, ConstraintViolationException.class })
    public ProblemDetail handleBadRequest(RuntimeException e) {
        LOGGER.debug("Rejected request: {}", e.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Invalid request", e);
    }

    @ExceptionHandler({ ExtractionException.class, EmbeddingServiceException.class, LlmServiceException.class })
    public ProblemDetail handleUpstreamFailure(Text2SqlException e) {
        LOGGER.warn("Upstream service failed: {}", e.getMessage());
        return problem(HttpStatus.BAD_GATEWAY, "Upstream service failed", e);
    }

    @ExceptionHandler(KnowledgeBaseException.class)
    public ProblemDetail handleKnowledgeBaseFailure(KnowledgeBaseException e) {
        LOGGER.error("Knowledge base operation failed", e);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Knowledge base failure", e);
    }

    private static ProblemDetail problem(HttpStatus status, String title, Exception e) {
        ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, e.getMessage());
        detail.setTitle(title);
        return detail;
    }
}
