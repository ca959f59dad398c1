package ru.dimension.wiredup;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.dimension.wiredup.services.Database;
import ru.dimension.wiredup.services.RequestLogger;

class WiredUpTest {

  @BeforeEach
  @AfterEach
  void clear() {
    WiredUp.reset();
  }

  @Test
  @DisplayName("Access before init is rejected")
  void notInitialized() {
    NotInitializedException ex = assertThrows(NotInitializedException.class, WiredUp::instance);
    assertTrue(ex.getMessage().contains("WiredUp.init()"));
  }

  @Test
  @DisplayName("Init installs a container and later calls register into it")
  void initAndExtend() {
    Container first = WiredUp.init(Registration.singleton("db", Target.construct(Database.class)));
    Container second = WiredUp.init(Registration.transientService("logger", Target.construct(RequestLogger.class)));

    assertSame(first, second);
    assertSame(first, WiredUp.instance());
    assertNotNull(WiredUp.instance().getService("db"));
    assertNotNull(WiredUp.instance().getService("logger"));
  }

  @Test
  @DisplayName("Reset forgets the container without destroying it")
  void reset() {
    Container installed = Container.builder().singleton("db", Target.construct(Database.class)).build();
    WiredUp.install(installed);

    assertSame(installed, WiredUp.reset());
    assertThrows(NotInitializedException.class, WiredUp::instance);
    assertTrue(installed.isInitialized());
  }
}
