package dev.fumaz.unbox.container;

import dev.fumaz.unbox.function.Injectable;
import dev.fumaz.unbox.module.Module;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModuleTest {

    static class Database {
        final String url;

        Database(String url) {
            this.url = url;
        }
    }

    static class DatabaseModule implements Module {
        @Override
        public void register(Container container) {
            container.set("url", "jdbc:h2:mem:test");
            container.register(Database.class);
        }
    }

    @Test
    void shouldInstallModulesInOrder() {
        Container container = Container.create(new DatabaseModule(),
                registry -> registry.configure("url", Injectable.of("url", String.class, url -> url + ";MODE=MySQL")));

        Database database = container.get(Database.class);

        assertEquals("jdbc:h2:mem:test;MODE=MySQL", database.url);
    }

    @Test
    void shouldInstallIntoExistingContainer() {
        Container container = new UnboxContainer();

        container.install(registry -> registry.set("greeting", "hello"));

        assertEquals("hello", container.get("greeting"));
    }
}
