package ru.dimension.wiredup;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.dimension.wiredup.services.Database;
import ru.dimension.wiredup.services.Report;
import ru.dimension.wiredup.services.RequestLogger;
import ru.dimension.wiredup.services.UnnamedParameterService;
import ru.dimension.wiredup.services.Worker;

class TargetTest {

  @Test
  @DisplayName("Constructor targets read dependency names from @Named parameters")
  void namedConstructor() {
    Target<Worker> target = Target.construct(Worker.class);

    assertEquals(Target.Kind.CONSTRUCTOR, target.kind());
    assertEquals(List.of("logger", "db"), target.dependencies());

    RequestLogger logger = new RequestLogger();
    Database db = new Database();
    Worker worker = target.invoke(Arguments.of(target.dependencies(), List.of(logger, db)));

    assertSame(logger, worker.logger());
    assertSame(db, worker.db());
  }

  @Test
  @DisplayName("Classes without @Named parameters need explicit names")
  void unnamedParameterRejected() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Target.construct(UnnamedParameterService.class));
    assertTrue(ex.getMessage().contains("@Named"));

    Target<UnnamedParameterService> explicit = Target.construct(UnnamedParameterService.class, "db");
    assertEquals(List.of("db"), explicit.dependencies());
  }

  @Test
  @DisplayName("Explicit names pick the constructor by arity with @Inject breaking ties")
  void injectBreaksTies() {
    Target<Report> target = Target.construct(Report.class, "logger");

    Report report = target.invoke(Arguments.of(List.of("logger"), List.of(new RequestLogger())));

    assertEquals("logger", report.source);
  }

  @Test
  @DisplayName("Explicit names without a matching constructor are rejected")
  void noMatchingArity() {
    assertThrows(IllegalArgumentException.class, () -> Target.construct(Database.class, "a", "b"));
  }

  @Test
  @DisplayName("Blank dependency names are rejected")
  void blankNames() {
    assertThrows(IllegalArgumentException.class, () -> Target.call(args -> null, "db", " "));
  }

  @Test
  @DisplayName("Callable targets receive arguments by position and by name")
  void callableArguments() {
    Target<String> target = Target.call(args -> args.get("user", String.class) + "@" + args.get(1), "user", "host");

    assertEquals(Target.Kind.CALLABLE, target.kind());
    assertEquals("alice@example", target.invoke(Arguments.of(List.of("user", "host"), List.of("alice", "example"))));
  }

  @Test
  @DisplayName("Instance targets return their value without dependencies")
  void instanceTarget() {
    Database db = new Database();
    Target<Database> target = Target.instance(db);

    assertTrue(target.dependencies().isEmpty());
    assertSame(db, target.invoke(Arguments.empty()));
  }

  @Test
  @DisplayName("Checked failures are wrapped and unchecked ones pass through")
  void failures() {
    Target<Object> checked = Target.call(args -> {
      throw new IOException("io");
    });
    Target<Object> unchecked = Target.call(args -> {
      throw new IllegalStateException("state");
    });

    ResolutionException wrapped = assertThrows(ResolutionException.class, () -> checked.invoke(Arguments.empty()));
    assertInstanceOf(IOException.class, wrapped.getCause());
    assertEquals("state",
                 assertThrows(IllegalStateException.class, () -> unchecked.invoke(Arguments.empty())).getMessage());
  }

  @Test
  @DisplayName("Reading an undeclared or mistyped argument is rejected")
  void argumentErrors() {
    Arguments args = Arguments.of(List.of("db"), List.of(new Database()));

    assertThrows(IllegalArgumentException.class, () -> args.get("logger", RequestLogger.class));
    assertThrows(ClassCastException.class, () -> args.get("db", RequestLogger.class));
    assertThrows(IllegalArgumentException.class, () -> Arguments.of(List.of("a", "b"), List.of(1)));
  }
}
