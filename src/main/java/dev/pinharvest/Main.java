package dev.pinharvest;

import ch.qos.logback.classic.Level;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "pin-harvester",
		version = "1.0.0",
		description = "Harvests Pinterest pins for keywords into per-keyword SQLite stores and downloads their images",
		mixinStandardHelpOptions = true,
		subcommands = {ScrapeCommand.class, DownloadCommand.class, MergeCommand.class, StatusCommand.class})
public class Main implements Callable<Integer> {
	/** Exit code when another process holds the keyword lock */
	public static final int EXIT_LOCKED = 2;

	@Spec
	CommandSpec spec;

	@Override
	public Integer call() {
		spec.commandLine().usage(System.out);
		return 0;
	}

	/** Raise the root logger to DEBUG for the rest of the run */
	static void enableDebugLogging() {
		Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
		if (root instanceof ch.qos.logback.classic.Logger) {
			((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
		}
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
