/*
 * Copyright (2025) The Delta Lake Project Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.sparkharness.context;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ComputeContextLifecycleTest {

  private RecordingLoggingContext logging;
  private List<FakeComputeContext> created;
  private RuntimeException failOnStop;
  private RuntimeException failOnCreate;
  private ComputeContextLifecycle lifecycle;

  @BeforeEach
  public void setUp() {
    logging = new RecordingLoggingContext(Level.INFO);
    created = new ArrayList<>();
    failOnStop = null;
    failOnCreate = null;
    lifecycle =
        new ComputeContextLifecycle(
            logging,
            (name, parallelism) -> {
              if (failOnCreate != null) {
                throw failOnCreate;
              }
              FakeComputeContext context = new FakeComputeContext(name, parallelism, failOnStop);
              created.add(context);
              return context;
            });
  }

  @Test
  public void startCreatesTwoWorkerContextNamedAfterTest() {
    lifecycle.start("com.example.MyTest", false);

    assertEquals(ContextState.ACTIVE, lifecycle.state());
    assertEquals(1, created.size());
    assertEquals("com.example.MyTest", lifecycle.context().name());
    assertEquals(2, lifecycle.context().parallelism());
  }

  @Test
  public void startForcesErrorLevelBeforeCreatingContext() {
    lifecycle =
        new ComputeContextLifecycle(
            logging,
            (name, parallelism) -> {
              assertEquals(Level.ERROR, logging.current());
              return new FakeComputeContext(name, parallelism, null);
            });

    lifecycle.start("t", false);
    lifecycle.stop();

    // no restore when logging was not disabled
    assertEquals(Arrays.asList(Level.INFO, Level.ERROR, Level.ERROR), logging.levels);
  }

  @Test
  public void levelIsForcedAgainWhenContextCreationResetsIt() {
    lifecycle =
        new ComputeContextLifecycle(
            logging,
            (name, parallelism) -> {
              // what Spark does when no log4j2 config is on the classpath
              logging.setLevel(Level.INFO);
              return new FakeComputeContext(name, parallelism, null);
            });

    lifecycle.start("t", false);

    assertEquals(Level.ERROR, logging.current());
  }

  @Test
  public void disabledLoggingStaysOffWhenContextCreationResetsIt() {
    lifecycle =
        new ComputeContextLifecycle(
            logging,
            (name, parallelism) -> {
              logging.setLevel(Level.INFO);
              return new FakeComputeContext(name, parallelism, null);
            });

    lifecycle.start("t", true);

    assertEquals(Level.OFF, logging.current());
  }

  @Test
  public void disabledLoggingIsRestoredToErrorNotToPreviousLevel() {
    lifecycle.start("t", true);
    assertEquals(Level.OFF, logging.current());

    lifecycle.stop();

    // the level before start was INFO, teardown lands on ERROR anyway
    assertEquals(Arrays.asList(Level.INFO, Level.OFF, Level.OFF, Level.ERROR), logging.levels);
  }

  @Test
  public void stopReleasesContextAndClearsReferences() {
    lifecycle.start("t", false);
    FakeComputeContext context = created.get(0);

    lifecycle.stop();

    assertEquals(ContextState.STOPPED, lifecycle.state());
    assertEquals(ContextState.STOPPED, context.state());
    assertEquals(1, context.stopCalls);
    assertThrows(LifecycleMisuseException.class, () -> lifecycle.context());
    assertThrows(LifecycleMisuseException.class, () -> lifecycle.session());
    assertThrows(LifecycleMisuseException.class, context::session);
  }

  @Test
  public void stopClearsProcessMarkers() {
    lifecycle.start("t", false);
    System.setProperty("spark.master.port", "7077");
    System.setProperty("spark.driver.port", "40000");

    lifecycle.stop();

    assertNull(System.getProperty("spark.master.port"));
    assertNull(System.getProperty("spark.driver.port"));
  }

  @Test
  public void lifecycleIsNotReusable() {
    lifecycle.start("t", false);
    assertThrows(LifecycleMisuseException.class, () -> lifecycle.start("t", false));

    lifecycle.stop();
    assertThrows(LifecycleMisuseException.class, () -> lifecycle.start("t", false));
    assertThrows(LifecycleMisuseException.class, () -> lifecycle.stop());
  }

  @Test
  public void contextIsUnavailableBeforeStart() {
    assertEquals(ContextState.UNINITIALIZED, lifecycle.state());
    assertThrows(LifecycleMisuseException.class, () -> lifecycle.context());
  }

  @Test
  public void failureToStopContextIsNotThrown() {
    failOnStop = new IllegalStateException("executor refused to die");
    lifecycle.start("t", true);

    lifecycle.stop();

    assertEquals(ContextState.STOPPED, lifecycle.state());
    assertEquals(Level.ERROR, logging.current());
  }

  @Test
  public void stopAfterFailedStartStillRestoresLogging() {
    failOnCreate = new IllegalStateException("no ports left");

    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> lifecycle.start("t", true));
    assertSame(failOnCreate, e);
    assertEquals(ContextState.UNINITIALIZED, lifecycle.state());

    lifecycle.stop();
    assertEquals(ContextState.STOPPED, lifecycle.state());
    assertEquals(Level.ERROR, logging.current());
  }

  @Test
  public void runScopedStopsContextWhenBodyThrows() {
    IllegalStateException boom = new IllegalStateException("test body failed");
    AtomicBoolean stoppedBeforePropagation = new AtomicBoolean();

    IllegalStateException thrown =
        assertThrows(
            IllegalStateException.class,
            () -> {
              try {
                lifecycle.runScoped("t", false, context -> {
                  throw boom;
                });
              } finally {
                stoppedBeforePropagation.set(created.get(0).state() == ContextState.STOPPED);
              }
            });

    assertSame(boom, thrown);
    assertTrue(stoppedBeforePropagation.get());
    assertEquals(ContextState.STOPPED, lifecycle.state());
  }

  @Test
  public void runScopedPassesActiveContextToBody() throws Exception {
    List<ContextState> seen = new ArrayList<>();

    lifecycle.runScoped("t", false, context -> seen.add(context.state()));

    assertEquals(Arrays.asList(ContextState.ACTIVE), seen);
    assertEquals(ContextState.STOPPED, created.get(0).state());
  }

  @Test
  public void runScopedDoesNotRunBodyWhenStartFails() {
    failOnCreate = new IllegalStateException("no ports left");
    AtomicBoolean ran = new AtomicBoolean();

    assertThrows(
        IllegalStateException.class,
        () -> lifecycle.runScoped("t", true, context -> ran.set(true)));

    assertFalse(ran.get());
    assertEquals(ContextState.STOPPED, lifecycle.state());
    assertEquals(Level.ERROR, logging.current());
  }

  @Test
  public void runScopedKeepsBodyFailureWhenTeardownAlsoFails() {
    AssertionError bodyFailure = new AssertionError("expected 1 but was 2");

    // the body stops the lifecycle itself, so the scoped stop() is a misuse
    AssertionError thrown =
        assertThrows(
            AssertionError.class,
            () ->
                lifecycle.runScoped(
                    "t",
                    false,
                    context -> {
                      lifecycle.stop();
                      throw bodyFailure;
                    }));

    assertSame(bodyFailure, thrown);
    assertEquals(1, thrown.getSuppressed().length);
    assertTrue(thrown.getSuppressed()[0] instanceof LifecycleMisuseException);
  }
}
