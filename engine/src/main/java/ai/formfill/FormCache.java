package ai.formfill;

import ai.formfill.form.FormData;
import ai.formfill.form.ParsedForm;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Parsed forms of the current page. Cleared wholesale on navigation. Not thread-safe. */
public final class FormCache {
    private final List<ParsedForm> forms = new ArrayList<>();

    /** Adds {@code form}, replacing an earlier entry for the same form. */
    public void put(ParsedForm form) {
        forms.removeIf(existing -> existing.formName().equals(form.formName())
                && existing.sourceUrl().equals(form.sourceUrl())
                && existing.targetUrl().equals(form.targetUrl()));
        forms.add(form);
    }

    public Optional<ParsedForm> find(FormData form) {
        return forms.stream().filter(f -> f.matches(form)).findFirst();
    }

    /**
     * First cached form with {@code signature}, in insertion order, that is not in {@code skip}. Unnamed forms with
     * the same fields share a signature, so a response carries one prediction per cached copy.
     */
    public Optional<ParsedForm> findBySignature(String signature, Set<ParsedForm> skip) {
        return forms.stream()
                .filter(f -> f.signature().equals(signature) && !skip.contains(f))
                .findFirst();
    }

    public List<ParsedForm> forms() {
        return List.copyOf(forms);
    }

    public int size() {
        return forms.size();
    }

    public boolean isEmpty() {
        return forms.isEmpty();
    }

    public void clear() {
        forms.clear();
    }
}
