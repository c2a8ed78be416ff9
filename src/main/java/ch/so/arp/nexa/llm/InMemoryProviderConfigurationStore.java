package ch.so.arp.nexa.llm;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class InMemoryProviderConfigurationStore implements ProviderConfigurationStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryProviderConfigurationStore.class);

    private final AtomicReference<ProviderConfiguration> current;

    InMemoryProviderConfigurationStore(ProviderConfiguration initial) {
        Objects.requireNonNull(initial, "initial").validate();
        this.current = new AtomicReference<>(initial);
    }

    @Override
    public ProviderConfiguration current() {
        return current.get();
    }

    @Override
    public ProviderConfiguration update(ProviderConfigurationUpdate update) {
        Objects.requireNonNull(update, "update");
        ProviderConfiguration previous = current.getAndUpdate(configuration -> configuration.merge(update));
        ProviderConfiguration published = previous.merge(update);
        if (previous.activeProvider() != published.activeProvider()
                || !previous.activeModel().equals(published.activeModel())) {
            LOGGER.info("Language model switched to {} / {} (configuration version {})",
                    published.activeProvider().id(), published.activeModel(), published.version());
        } else {
            LOGGER.info("Provider configuration updated to version {}", published.version());
        }
        return published;
    }
}
