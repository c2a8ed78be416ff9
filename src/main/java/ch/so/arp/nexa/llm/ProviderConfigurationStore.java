package ch.so.arp.nexa.llm;

/**
 * Holder of the current {@link ProviderConfiguration}.
 */
public interface ProviderConfigurationStore {

    ProviderConfiguration current();

    /**
     * Merge the update into the current configuration and publish the result
     * atomically. Calls already dispatched are not affected.
     *
     * @return the published configuration
     * @throws ch.so.arp.nexa.error.ConfigurationException if the merged
     *         configuration is invalid; the current one stays in place
     */
    ProviderConfiguration update(ProviderConfigurationUpdate update);
}
