package ai.formfill.form;

/**
 * Heuristic classifier that assigns a predicted type to each field of a form. Implementations usually delegate to
 * {@link ParsedForm#fromHeuristics}.
 */
@FunctionalInterface
public interface FormParser {

    ParsedForm parse(FormData form);
}
