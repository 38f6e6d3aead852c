package dev.tessera.testrunner;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Map;

public class TestRunner {

	private static final Logger log = LoggerFactory.getLogger(TestRunner.class);

	public static void main(String[] args) {
		int exitCode;
		try {
			exitCode = run(args, System.getenv(), System.out);
		}
		catch(IOException | IllegalArgumentException | UnsupportedOperationException e) {
			log.error("Test run aborted: {}", e.getMessage(), e);
			exitCode = 1;
		}

		System.exit(exitCode);
	}

	/**
	 * Runs the tests described by the arguments and environment.
	 *
	 * @return the process exit status: 0 when every test passed, 1 otherwise
	 */
	static int run(String[] args, Map<String, String> env, PrintStream out) throws IOException {
		var testArgs = new TestRunnerArgs();
		var commander = JCommander.newBuilder()
			.programName("test-runner")
			.addObject(testArgs)
			.build();

		RunnerConfig config;
		try {
			commander.parse(args);
			if(testArgs.help) {
				printUsage(commander, out);
				return 0;
			}

			config = testArgs.toConfig();
		}
		catch(ParameterException e) {
			out.println(e.getMessage());
			printUsage(commander, out);
			return 1;
		}

		var environment = TestEnvironment.fromMap(env);
		if(environment.statusFile() != null) {
			StatusFile.touch(environment.statusFile());
		}

		var logger = new TestLogger(out, testArgs.color, testArgs.verbosity);
		var passed = new TestOrchestrator(config, environment, logger).run();
		return passed ? 0 : 1;
	}

	private static void printUsage(JCommander commander, PrintStream out) {
		var usage = new StringBuilder();
		commander.getUsageFormatter().usage(usage);
		out.print(usage);
	}
}
