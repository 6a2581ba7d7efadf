package dev.jbang.mediafetch;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "media-fetch",
		version = "1.0.0",
		description = "Downloads message attachments with adaptive concurrency",
		mixinStandardHelpOptions = true,
		subcommands = {DownloadCommand.class, CleanCommand.class})
public class Main implements Callable<Integer> {

	@Spec
	private CommandLine.Model.CommandSpec spec;

	@Override
	public Integer call() {
		spec.commandLine().usage(System.out);
		return 0;
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
