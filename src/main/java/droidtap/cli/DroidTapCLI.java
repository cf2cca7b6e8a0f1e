package droidtap.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import droidtap.device.DeviceException;
import droidtap.model.UIElement;
import droidtap.resolver.ResolutionCascade;
import droidtap.resolver.ResolutionResult;
import droidtap.resolver.ResolverConfig;
import droidtap.tree.UiAutomatorTree;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line entry point.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code droidtap tap <query...>} resolve a query and tap it</li>
 *   <li>{@code droidtap texts}          list the text visible on screen</li>
 *   <li>{@code droidtap describe}       one-paragraph summary of the screen</li>
 *   <li>{@code droidtap dump [--json]}  print every accessibility node</li>
 * </ul>
 */
@Command(
        name        = "droidtap",
        description = "Tap Android UI elements by describing them",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                DroidTapCLI.TapCommand.class,
                DroidTapCLI.TextsCommand.class,
                DroidTapCLI.DescribeCommand.class,
                DroidTapCLI.DumpCommand.class
        }
)
public class DroidTapCLI implements Callable<Integer> {

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(String[] args) {
        int exit = new CommandLine(new DroidTapCLI()).execute(args);
        System.exit(exit);
    }

    /** Checks that adb sees a device, printing the reason when it does not. */
    static boolean deviceReady(ResolverConfig config) {
        try {
            List<String> devices = config.createAdbClient().ensureDevice();
            if (devices.size() > 1 && config.getAdbSerial().isEmpty()) {
                System.err.println("Several devices attached " + devices + "; set adb.serial to pick one");
                return false;
            }
            return true;
        } catch (DeviceException e) {
            System.err.println("Device not available: " + e.getMessage());
            return false;
        }
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    /**
     * Resolves one query. Exit code 0 when tapped, 2 when nothing matched,
     * 1 when the device is unreachable.
     */
    @Command(name = "tap", description = "Resolve a query and tap the element", mixinStandardHelpOptions = true)
    static class TapCommand implements Callable<Integer> {

        @Parameters(arity = "1..*", description = "What to tap, e.g. \"the subscribe button\"")
        List<String> words;

        @Option(names = {"-w", "--watch"},
                description = "Keep a screenshot warm in the background while resolving (vision only)")
        boolean watch;

        @Override
        public Integer call() {
            String query = String.join(" ", words);
            ResolverConfig config = new ResolverConfig();
            if (!deviceReady(config)) return 1;
            ResolutionCascade cascade = config.createCascade();

            if (watch) cascade.startBackgroundCapture();
            try {
                ResolutionResult result = cascade.resolve(query);
                if (result.resolved()) {
                    System.out.printf("Tapped '%s' at %s via %s%n",
                            result.target().label(), result.target().point(), result.target().tier());
                    return 0;
                }
                System.err.printf("Not found: %s (%s)%n", query, result.failureReason());
                return 2;
            } finally {
                if (watch) cascade.stopBackgroundCapture();
            }
        }
    }

    @Command(name = "texts", description = "List visible text on the current screen", mixinStandardHelpOptions = true)
    static class TextsCommand implements Callable<Integer> {

        @Override
        public Integer call() {
            ResolverConfig config = new ResolverConfig();
            if (!deviceReady(config)) return 1;
            List<String> texts = config.createCascade().listVisibleText();
            texts.forEach(System.out::println);
            return texts.isEmpty() ? 2 : 0;
        }
    }

    @Command(name = "describe", description = "Summarise the current screen", mixinStandardHelpOptions = true)
    static class DescribeCommand implements Callable<Integer> {

        @Override
        public Integer call() {
            ResolverConfig config = new ResolverConfig();
            if (!deviceReady(config)) return 1;
            System.out.println(config.createCascade().describeScreen());
            return 0;
        }
    }

    /**
     * Prints the raw accessibility capture, one node per line or as a JSON array.
     */
    @Command(name = "dump", description = "Print the accessibility tree", mixinStandardHelpOptions = true)
    static class DumpCommand implements Callable<Integer> {

        @Option(names = "--json", description = "Print as a JSON array")
        boolean json;

        @Override
        public Integer call() throws Exception {
            ResolverConfig config = new ResolverConfig();
            if (!deviceReady(config)) return 1;
            List<UIElement> elements;
            try {
                elements = new UiAutomatorTree(config.createDevice()).captureTree();
            } catch (DeviceException e) {
                System.err.println("Could not capture the tree: " + e.getMessage());
                return 1;
            }

            if (json) {
                ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
                System.out.println(mapper.writeValueAsString(elements));
            } else {
                elements.forEach(System.out::println);
            }
            return 0;
        }
    }
}
