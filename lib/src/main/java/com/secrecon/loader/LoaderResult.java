package com.secrecon.loader;

import com.secrecon.store.FilingDataset;
import java.util.List;

/** Container for a loaded dataset and the diagnostics collected while reading it. */
public final class LoaderResult {
    private final FilingDataset dataset;
    private final List<LoaderMessage> messages;

    public LoaderResult(FilingDataset dataset, List<LoaderMessage> messages) {
        this.dataset = dataset;
        this.messages = List.copyOf(messages);
    }

    public FilingDataset getDataset() {
        return dataset;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }

    public List<LoaderMessage> messagesAt(LoaderMessage.Level level) {
        return messages.stream().filter(message -> message.getLevel() == level).toList();
    }
}
