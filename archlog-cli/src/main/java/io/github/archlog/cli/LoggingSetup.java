package io.github.archlog.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.nio.file.Path;

/**
 * Reloads the Logback configuration once the logs directory and verbosity are known.
 *
 * <p>
 * {@code logback.xml} reads {@value #LOGS_DIR_PROPERTY} and {@value #CONSOLE_LEVEL_PROPERTY}
 * from the logger context.
 */
final class LoggingSetup {

	static final String LOGS_DIR_PROPERTY = "archlog.logs.dir";

	static final String CONSOLE_LEVEL_PROPERTY = "archlog.console.level";

	private LoggingSetup() {
	}

	static void configure(Path logsDir, boolean verbose) {
		if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext)) {
			return;
		}
		LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
		URL configuration = LoggingSetup.class.getResource("/logback.xml");
		if (configuration == null) {
			return;
		}
		context.reset();
		context.putProperty(LOGS_DIR_PROPERTY, logsDir.toAbsolutePath().toString());
		context.putProperty(CONSOLE_LEVEL_PROPERTY, verbose ? "DEBUG" : "INFO");
		JoranConfigurator configurator = new JoranConfigurator();
		configurator.setContext(context);
		try {
			configurator.doConfigure(configuration);
		}
		catch (JoranException e) {
			throw new IllegalStateException("Failed to configure logging: " + e.getMessage(), e);
		}
	}

}
