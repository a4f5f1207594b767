package org.islandora.handle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ReconcileResult is the outcome of a single HandleReconciler operation: whether it succeeded and
 * every message emitted along the way.
 */
public record ReconcileResult(boolean success, List<Message> messages) {

    public ReconcileResult {
        messages = Collections.unmodifiableList(new ArrayList<>(messages));
    }

    public static ReconcileResult succeeded() {
        return new ReconcileResult(true, Collections.emptyList());
    }

    public static ReconcileResult succeeded(Message message) {
        return new ReconcileResult(true, List.of(message));
    }

    public static ReconcileResult failed(Message message) {
        return new ReconcileResult(false, List.of(message));
    }

    /**
     * @param channel Channel to filter on
     * @return Messages emitted on the given channel, in order
     */
    public List<Message> messagesOn(MessageChannel channel) {
        List<Message> onChannel = new ArrayList<>();
        for (Message message : messages) {
            if (message.channel() == channel) {
                onChannel.add(message);
            }
        }
        return onChannel;
    }
}
