package com.lyshra.open.desk.core.engine.action;

import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionProvider;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LyshraOpenDeskActionProviderRegistryTest {

    @Test
    void providers_keepRegistrationOrder() {
        LyshraOpenDeskActionProviderRegistry registry = new LyshraOpenDeskActionProviderRegistry()
                .register(named("b"))
                .registerAll(List.of(named("a"), named("c")));

        assertEquals(List.of("b", "a", "c"), registry.getProviders().stream().map(ILyshraOpenDeskActionProvider::getName).toList());
        assertEquals(3, registry.size());
    }

    @Test
    void unregister_removesEveryInstanceWithTheName() {
        LyshraOpenDeskActionProviderRegistry registry = new LyshraOpenDeskActionProviderRegistry()
                .register(named("a"))
                .register(named("a"))
                .register(named("b"));

        assertTrue(registry.unregister("a"));
        assertFalse(registry.unregister("missing"));
        assertEquals(1, registry.size());
    }

    @Test
    void providersView_isACopy() {
        LyshraOpenDeskActionProviderRegistry registry = new LyshraOpenDeskActionProviderRegistry().register(named("a"));
        List<ILyshraOpenDeskActionProvider> providers = registry.getProviders();

        registry.register(named("b"));

        assertEquals(1, providers.size());
        assertThrows(UnsupportedOperationException.class, () -> providers.add(named("c")));
    }

    @Test
    void nullProvider_isRejected() {
        assertThrows(NullPointerException.class, () -> new LyshraOpenDeskActionProviderRegistry().register(null));
    }

    private static ILyshraOpenDeskActionProvider named(String name) {
        return new ILyshraOpenDeskActionProvider() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public List<ILyshraOpenDeskAction> getActions(ILyshraOpenDeskActionContext context) {
                return List.of();
            }
        };
    }
}
