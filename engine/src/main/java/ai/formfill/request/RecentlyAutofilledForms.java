package ai.formfill.request;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Signatures of the forms most recently filled, newest first. Uploads consult it to tell the classification service
 * whether the submitted form had been autofilled. Not thread-safe.
 */
public final class RecentlyAutofilledForms {
    public static final int CAPACITY = 3;

    private final Deque<String> signatures = new ArrayDeque<>();

    /** Records a fill, then cuts the history back to the {@value #CAPACITY} newest entries in one step. */
    public void record(String formSignature) {
        signatures.addFirst(formSignature);
        if (signatures.size() > CAPACITY) {
            var newest = signatures.stream().limit(CAPACITY).collect(Collectors.toList());
            signatures.clear();
            signatures.addAll(newest);
        }
    }

    public boolean wasRecentlyAutofilled(String formSignature) {
        return signatures.stream().limit(CAPACITY).anyMatch(formSignature::equals);
    }

    /** Newest first. */
    public List<String> signatures() {
        return List.copyOf(signatures);
    }

    public int size() {
        return signatures.size();
    }
}
