package prose;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import prose.exec.ExecutionResult;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Outcome of one translation request, successful or not, in a form that can
 * be handed to other tools as JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranslationResult(
		boolean success,
		String code,
		ErrorKind errorKind,
		Integer statementIndex,
		String errorMessage,
		List<String> warnings,
		String originalText,
		long translationTimeMillis,
		ExecutionResult execution) {

	private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

	public TranslationResult {
		warnings = warnings == null ? List.of() : List.copyOf(warnings);
	}

	public static TranslationResult success(String originalText, Translation translation, long elapsedMillis) {
		return new TranslationResult(true, translation.source(), null, null, null, translation.warnings(),
				originalText, elapsedMillis, null);
	}

	public static TranslationResult failure(String originalText, TranslationException error, long elapsedMillis) {
		Integer index = error.statementIndex() > 0 ? error.statementIndex() : null;
		return new TranslationResult(false, null, error.kind(), index, error.getMessage(), List.of(),
				originalText, elapsedMillis, null);
	}

	public TranslationResult withExecution(ExecutionResult execution) {
		return new TranslationResult(success, code, errorKind, statementIndex, errorMessage, warnings, originalText,
				translationTimeMillis, execution);
	}

	public String toJson() {
		try {
			return MAPPER.writeValueAsString(this);
		} catch (JsonProcessingException e) {
			throw new UncheckedIOException(e);
		}
	}
}
