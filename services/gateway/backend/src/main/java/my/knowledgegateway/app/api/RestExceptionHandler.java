package my.knowledgegateway.app.api;

import jakarta.servlet.http.HttpServletRequest;
import my.knowledgegateway.app.dto.AssetIngestResponseDto;
import my.knowledgegateway.app.graph.GraphQueryException;
import my.knowledgegateway.app.service.AssetIngestException;
import my.knowledgegateway.app.service.AssetNotFoundException;
import my.knowledgegateway.app.service.RemoteSourceConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.HandlerMapping;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestControllerAdvice
public class RestExceptionHandler {
	private static final Logger logger = LoggerFactory.getLogger(RestExceptionHandler.class);
	private static final String UNTRUSTED_SOURCE_DETAIL = "Graph source is not a trusted remote node.";

	@ExceptionHandler(RemoteSourceConfigException.class)
	public ProblemDetail handleRemoteSource(RemoteSourceConfigException ex, HttpServletRequest request) {
		logger.warn("Rejected request on {}: {}", request.getRequestURI(), ex.getMessage());
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
		detail.setTitle("Invalid graph source");
		detail.setDetail(UNTRUSTED_SOURCE_DETAIL);
		notFoundProperties(detail, request);
		return detail;
	}

	@ExceptionHandler(GraphQueryException.class)
	public ProblemDetail handleGraphQuery(GraphQueryException ex, HttpServletRequest request) {
		logger.warn("Graph query failed on {} (status={}): {}", request.getRequestURI(), ex.getStatusCode(), ex.getMessage());
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
		detail.setTitle("Not Found");
		detail.setDetail("The data may not be indexed yet.");
		notFoundProperties(detail, request);
		return detail;
	}

	@ExceptionHandler(AssetNotFoundException.class)
	public ProblemDetail handleAssetNotFound(AssetNotFoundException ex, HttpServletRequest request) {
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
		detail.setTitle("Not Found");
		detail.setDetail("No knowledge asset found for this topic.");
		notFoundProperties(detail, request);
		detail.setProperty("topicId", ex.getTopicId());
		return detail;
	}

	@ExceptionHandler(AssetIngestException.class)
	public ResponseEntity<AssetIngestResponseDto> handleIngest(AssetIngestException ex, HttpServletRequest request) {
		if (ex.getStatus().is5xxServerError()) {
			logger.error("Publishing failed on {}: {}", request.getRequestURI(), ex.getMessage());
		} else {
			logger.warn("Rejected publish request on {}: {}", request.getRequestURI(), ex.getMessage());
		}
		return ResponseEntity.status(ex.getStatus())
				.body(new AssetIngestResponseDto(false, null, ex.getMessage(), null));
	}

	@ExceptionHandler(MethodArgumentTypeMismatchException.class)
	public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
		logger.warn("Invalid parameter {} on {}", ex.getName(), request.getRequestURI());
		return badRequest("Invalid value for parameter '" + ex.getName() + "'.", request);
	}

	@ExceptionHandler(HttpMessageNotReadableException.class)
	public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
		logger.warn("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMessage());
		return badRequest("Malformed request body.", request);
	}

	@ExceptionHandler(NoResourceFoundException.class)
	public ProblemDetail handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
		detail.setTitle("Not Found");
		detail.setDetail("Resource not found.");
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ProblemDetail handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
		logger.warn("Validation failed on {}", request.getRequestURI());
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
		detail.setTitle("Validation failed");
		List<String> errors = ex.getBindingResult().getFieldErrors().stream()
				.map(this::formatFieldError)
				.toList();
		detail.setProperty("errors", errors);
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	@ExceptionHandler(Exception.class)
	public ProblemDetail handleUnhandled(Exception ex, HttpServletRequest request) {
		String reference = "GW-" + UUID.randomUUID().toString().substring(0, 8);
		logger.error("Unexpected error on {} (ref={})", request.getRequestURI(), reference, ex);
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
		detail.setTitle("Internal Server Error");
		detail.setDetail("Unexpected error");
		detail.setProperty("reference", reference);
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	private ProblemDetail badRequest(String message, HttpServletRequest request) {
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
		detail.setTitle("Bad Request");
		detail.setDetail(message);
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	private void notFoundProperties(ProblemDetail detail, HttpServletRequest request) {
		detail.setProperty("found", false);
		detail.setProperty("path", request.getRequestURI());
		String topicId = topicId(request);
		if (topicId != null) {
			detail.setProperty("topicId", topicId);
		}
	}

	private String topicId(HttpServletRequest request) {
		Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
		if (variables instanceof Map<?, ?> map) {
			Object value = map.get("topicId");
			return value == null ? null : value.toString();
		}
		return null;
	}

	private String formatFieldError(FieldError error) {
		return error.getField() + ": " + error.getDefaultMessage();
	}
}
