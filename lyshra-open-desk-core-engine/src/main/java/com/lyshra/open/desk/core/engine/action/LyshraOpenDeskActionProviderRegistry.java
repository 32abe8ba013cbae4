package com.lyshra.open.desk.core.engine.action;

import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered set of action providers. Providers are consulted in registration order.
 */
@Slf4j
public class LyshraOpenDeskActionProviderRegistry {

    private final List<ILyshraOpenDeskActionProvider> providers = new CopyOnWriteArrayList<>();

    public LyshraOpenDeskActionProviderRegistry register(ILyshraOpenDeskActionProvider provider) {
        Objects.requireNonNull(provider, "provider");
        if (providers.stream().anyMatch(existing -> existing.getName().equals(provider.getName()))) {
            log.warn("Action provider [{}] is already registered, registering another instance", provider.getName());
        }
        providers.add(provider);
        log.debug("Registered action provider: [{}]", provider.getName());
        return this;
    }

    public LyshraOpenDeskActionProviderRegistry registerAll(Collection<? extends ILyshraOpenDeskActionProvider> providersToAdd) {
        providersToAdd.forEach(this::register);
        return this;
    }

    public boolean unregister(String providerName) {
        boolean removed = providers.removeIf(provider -> provider.getName().equals(providerName));
        if (removed) {
            log.debug("Unregistered action provider: [{}]", providerName);
        }
        return removed;
    }

    public List<ILyshraOpenDeskActionProvider> getProviders() {
        return List.copyOf(providers);
    }

    public int size() {
        return providers.size();
    }
}
