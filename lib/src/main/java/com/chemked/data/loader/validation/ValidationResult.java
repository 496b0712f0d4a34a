package com.chemked.data.loader.validation;

import com.chemked.data.loader.LoaderMessage;
import java.util.List;
import java.util.stream.Collectors;

/** Outcome of validating one document: valid when no message is an error. */
public final class ValidationResult {
    private final List<LoaderMessage> messages;

    public ValidationResult(List<LoaderMessage> messages) {
        this.messages = List.copyOf(messages);
    }

    public boolean isValid() {
        return messages.stream().noneMatch(LoaderMessage::isError);
    }

    /** Every message in the order it was produced. */
    public List<LoaderMessage> getMessages() {
        return messages;
    }

    public List<LoaderMessage> getErrors() {
        return messages.stream().filter(LoaderMessage::isError).collect(Collectors.toList());
    }

    public List<LoaderMessage> getWarnings() {
        return messages.stream()
                .filter(message -> message.getLevel() == LoaderMessage.Level.WARNING)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return (isValid() ? "valid" : "invalid") + " " + messages;
    }
}
