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
package io.sparkharness.logging;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;

/**
 * {@link LoggingContext} backed by the log4j2 core context that Spark binds slf4j to.
 *
 * <p>Every logger that has been handed out so far gets a logger config of its own at the target
 * level, so loggers that were inheriting a more verbose level from a parent config are forced as
 * well.
 */
public class Log4jLoggingContext implements LoggingContext {

  @Override
  public void setLevel(Level level) {
    Object spiContext = LogManager.getContext(false);
    if (!(spiContext instanceof LoggerContext)) {
      // Another log4j-api implementation is bound; nothing we can force.
      return;
    }
    LoggerContext context = (LoggerContext) spiContext;
    Configuration config = context.getConfiguration();

    config.getRootLogger().setLevel(level);
    for (LoggerConfig loggerConfig : config.getLoggers().values()) {
      loggerConfig.setLevel(level);
    }
    for (Logger logger : context.getLoggers()) {
      String name = logger.getName();
      if (name.isEmpty()) {
        continue;
      }
      LoggerConfig loggerConfig = config.getLoggerConfig(name);
      if (!loggerConfig.getName().equals(name)) {
        LoggerConfig own = new LoggerConfig(name, level, true);
        config.addLogger(name, own);
      }
    }
    context.updateLoggers();
  }
}
