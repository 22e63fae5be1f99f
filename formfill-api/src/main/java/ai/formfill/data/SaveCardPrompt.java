package ai.formfill.data;

import java.util.function.Consumer;

/** UI surface that asks the user whether a card captured from a submitted form should be saved. */
@FunctionalInterface
public interface SaveCardPrompt {

    /**
     * Shows the offer. {@code onClosed} receives {@code true} when the user accepts, {@code false} when the offer is
     * declined or dismissed.
     */
    void offer(PaymentCard card, Consumer<Boolean> onClosed);

    static SaveCardPrompt declineAll() {
        return (card, onClosed) -> onClosed.accept(false);
    }
}
