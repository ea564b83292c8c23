package com.grpatch;

import static com.google.common.base.Preconditions.checkArgument;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.Option;
import static picocli.CommandLine.Parameters;
import static picocli.CommandLine.ParentCommand;

import com.google.common.base.Stopwatch;
import com.grpatch.gridworld.Cell;
import com.grpatch.gridworld.GridWorld;
import com.grpatch.gridworld.MovingObstacleGridWorld;
import com.grpatch.gridworld.RandomWorlds;
import com.grpatch.gridworld.Trolls;
import com.grpatch.incremental.LocalPatcher;
import com.grpatch.model.Automaton;
import com.grpatch.model.Valuation;
import com.grpatch.output.AutomatonXmlWriter;
import com.grpatch.output.Gr1cAutWriter;
import com.grpatch.output.JtlvAutomatonWriter;
import com.grpatch.output.StrategyJsonWriter;
import com.grpatch.parser.AutomatonXmlParser;
import com.grpatch.solver.EngineConfig;
import com.grpatch.solver.Gr1cEngine;
import com.grpatch.solver.ToolLog;
import com.grpatch.spec.GrSpec;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import picocli.CommandLine;

@Command(
    name = "grpatch",
    mixinStandardHelpOptions = true,
    version = "GR(1) strategy patching 0.1",
    description = "Synthesizes and locally patches GR(1) strategies for grid worlds",
    subcommands = {Main.Synth.class, Main.GridSpec.class, Main.RandomWorld.class, Main.PatchCell.class})
public final class Main implements Callable<Integer> {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    static final int NOT_REALIZABLE = 2;

    enum Format {
        XML, JSON, LEGACY, AUT
    }

    @Option(
        names = {"-v", "--verbose"},
        description = "Log details of neighborhoods and gr1c calls")
    private boolean verbose = false;

    @Nullable
    @Option(
        names = {"--gr1c"},
        description = "gr1c executable (default: $GR1C_BIN or gr1c)")
    private String gr1c;

    @Option(
        names = {"--tool-log"},
        description = "Logging requested from gr1c. Valid: ${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE}")
    private ToolLog toolLog = ToolLog.NONE;

    @Option(
        names = {"--keep-files"},
        description = "Keep the files written for gr1c in this directory")
    @Nullable
    private Path keepFiles;

    private Main() {}

    public static void main(String[] args) {
        installLogging();
        System.exit(new CommandLine(new Main())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .execute(args));
    }

    private static void installLogging() {
        try (InputStream properties = Main.class.getResourceAsStream("/logging.properties")) {
            if (properties != null) {
                LogManager.getLogManager().readConfiguration(properties);
            }
        } catch (IOException e) {
            System.err.println("Could not read logging configuration: " + e.getMessage());
        }
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    private Gr1cEngine engine() {
        if (verbose) {
            Logger.getLogger("").setLevel(Level.FINE);
            for (var handler : Logger.getLogger("").getHandlers()) {
                handler.setLevel(Level.FINE);
            }
        }
        EngineConfig config = EngineConfig.defaults().withToolLog(toolLog);
        if (gr1c != null) {
            config = config.withBinary(gr1c);
        }
        if (keepFiles != null) {
            config = config.withWorkDirectory(keepFiles, true);
        }
        return new Gr1cEngine(config);
    }

    private static PrintStream open(String output) throws IOException {
        return "-".equals(output)
            ? System.out
            : new PrintStream(new BufferedOutputStream(Files.newOutputStream(Path.of(output))));
    }

    private static void write(String output, Automaton strategy, GrSpec spec, Format format) throws IOException {
        PrintStream stream = open(output);
        try {
            switch (format) {
                case XML -> AutomatonXmlWriter.write(strategy, AutomatonXmlWriter.Schema.V1, stream);
                case JSON -> StrategyJsonWriter.write(strategy, spec, stream);
                case LEGACY -> JtlvAutomatonWriter.write(strategy, stream);
                case AUT -> Gr1cAutWriter.write(strategy, spec.variables(), stream);
            }
        } finally {
            if (stream == System.out) {
                stream.flush();
            } else {
                stream.close();
            }
        }
    }

    private static GridWorld loadWorld(Path file, String prefix, boolean trolls) throws IOException {
        String description = Files.readString(file);
        return trolls ? MovingObstacleGridWorld.load(description, prefix) : GridWorld.load(description, prefix);
    }

    @Command(name = "synth", description = "Check and synthesize a specification in the gr1c language")
    static final class Synth implements Callable<Integer> {
        @ParentCommand
        private Main main;

        @Parameters(index = "0", description = "Specification file")
        private Path specFile;

        @Option(names = {"-r", "--realizability"}, description = "Only check realizability")
        private boolean realizabilityOnly = false;

        @Option(
            names = {"-f", "--format"},
            description = "Strategy format, XML or LEGACY. Default: ${DEFAULT-VALUE}")
        private Format format = Format.XML;

        @Option(names = {"-O", "--output"}, description = "Strategy destination")
        private String output = "-";

        @Override
        public Integer call() throws IOException {
            checkArgument(format == Format.XML || format == Format.LEGACY,
                "Only XML and LEGACY output is available without a grid world");
            String specification = Files.readString(specFile);
            Gr1cEngine engine = main.engine();
            if (!engine.checkSyntax(specification)) {
                System.err.println("Syntax error in " + specFile);
                return 1;
            }
            if (realizabilityOnly) {
                boolean realizable = engine.checkRealizable(specification);
                System.out.println(realizable ? "Realizable" : "Not realizable");
                return realizable ? 0 : NOT_REALIZABLE;
            }
            Optional<Automaton> strategy = engine.synthesize(specification);
            if (strategy.isEmpty()) {
                System.err.println("Not realizable");
                return NOT_REALIZABLE;
            }
            write(output, strategy.get(), new GrSpec(), format);
            return 0;
        }
    }

    @Command(name = "gridworld", description = "Print the gr1c specification of a grid world")
    static final class GridSpec implements Callable<Integer> {
        @Parameters(index = "0", description = "Grid world description")
        private Path gridFile;

        @Option(names = "--prefix", description = "Prefix of cell variables. Default: ${DEFAULT-VALUE}")
        private String prefix = GridWorld.DEFAULT_PREFIX;

        @Option(names = "--nonbool", description = "Encode positions as integer row and column variables")
        private boolean nonbool = false;

        @Option(names = "--trolls", description = "Treat E cells as trolls of radius one")
        private boolean trolls = false;

        @Option(names = "--sequence", description = "Visit the goals in order")
        private boolean sequence = false;

        @Override
        public Integer call() throws IOException {
            GridWorld world = loadWorld(gridFile, prefix, trolls);
            GrSpec spec;
            if (trolls) {
                spec = ((MovingObstacleGridWorld) world).mspec("X", nonbool);
            } else if (sequence) {
                spec = world.sequencedSpec(Cell.ORIGIN, true, nonbool, "goal");
            } else {
                spec = world.spec(Cell.ORIGIN, true, nonbool);
            }
            System.out.print(spec.toGr1c());
            return 0;
        }
    }

    @Command(name = "random-world", description = "Print a random grid world description")
    static final class RandomWorld implements Callable<Integer> {
        @Option(names = "--size", description = "Rows and columns, e.g. 5x10. Default: ${DEFAULT-VALUE}")
        private String size = "5x10";

        @Option(names = "--density", description = "Fraction of wall cells. Default: ${DEFAULT-VALUE}")
        private double density = 0.2;

        @Option(names = "--inits", description = "Number of initial cells. Default: ${DEFAULT-VALUE}")
        private int inits = 1;

        @Option(names = "--goals", description = "Number of goal cells. Default: ${DEFAULT-VALUE}")
        private int goals = 2;

        @Option(names = "--trolls", description = "Number of trolls. Default: ${DEFAULT-VALUE}")
        private int trolls = 0;

        @Option(names = "--feasible", description = "Keep all initial and goal cells mutually reachable")
        private boolean feasible = false;

        @Nullable
        @Option(names = "--timeout", description = "Seconds to search for a feasible world")
        private Long timeout;

        @Nullable
        @Option(names = "--seed", description = "Random seed")
        private Long seed;

        @Override
        public Integer call() {
            String[] dimensions = size.toLowerCase().split("x");
            checkArgument(dimensions.length == 2, "Malformed size %s", size);
            RandomWorlds.Settings settings = RandomWorlds.Settings.of(
                    Integer.parseInt(dimensions[0].trim()), Integer.parseInt(dimensions[1].trim()), density)
                .withFeatures(inits, goals, trolls);
            if (feasible) {
                settings = settings.withFeasibility(timeout == null ? null : Duration.ofSeconds(timeout));
            }
            Random random = seed == null ? new Random() : new Random(seed);

            Stopwatch stopwatch = Stopwatch.createStarted();
            RandomWorlds.Outcome outcome = RandomWorlds.randomWorld(settings, random);
            log.log(Level.INFO, () -> "Generating took %s".formatted(stopwatch));
            return switch (outcome.status()) {
                case GENERATED -> {
                    System.out.print(outcome.requireWorld().dump());
                    yield 0;
                }
                case INFEASIBLE -> {
                    System.err.println("No feasible world with these settings");
                    yield NOT_REALIZABLE;
                }
                case TIMED_OUT -> {
                    System.err.println("Timed out");
                    yield 1;
                }
            };
        }
    }

    @Command(name = "patch-cell", description = "Patch a grid world strategy after a cell became blocked")
    static final class PatchCell implements Callable<Integer> {
        @ParentCommand
        private Main main;

        @Parameters(index = "0", description = "Grid world description")
        private Path gridFile;

        @Nullable
        @Option(names = "--strategy", description = "Strategy in XML; synthesized from the world if missing")
        private Path strategyFile;

        @Option(names = "--cell", required = true, description = "Blocked cell as row,col")
        private String cell;

        @Option(names = "--radius", description = "Neighborhood radius. Default: ${DEFAULT-VALUE}")
        private int radius = 1;

        @Option(names = "--nonbool", description = "Encode positions as integer row and column variables")
        private boolean nonbool = false;

        @Option(names = "--trolls", description = "Treat E cells as trolls of radius one")
        private boolean trolls = false;

        @Option(names = {"-f", "--format"}, description = "Strategy format. Default: ${DEFAULT-VALUE}")
        private Format format = Format.XML;

        @Option(names = {"-O", "--output"}, description = "Strategy destination")
        private String output = "-";

        @Override
        public Integer call() throws IOException {
            String[] coordinates = cell.split(",");
            checkArgument(coordinates.length == 2, "Malformed cell %s", cell);
            Cell blocked = Cell.of(Integer.parseInt(coordinates[0].trim()), Integer.parseInt(coordinates[1].trim()));

            GridWorld world = loadWorld(gridFile, GridWorld.DEFAULT_PREFIX, trolls);
            GrSpec spec;
            List<List<Valuation>> nonmetric;
            if (trolls) {
                var trollSpec = Trolls.addTrolls(world, ((MovingObstacleGridWorld) world).trolls(), "X", false,
                    nonbool);
                spec = trollSpec.spec();
                nonmetric = trollSpec.moves();
            } else {
                spec = world.spec(Cell.ORIGIN, true, nonbool);
                nonmetric = List.of();
            }

            Gr1cEngine engine = main.engine();
            Optional<Automaton> strategy = strategyFile == null
                ? engine.synthesize(spec)
                : Optional.of(AutomatonXmlParser.parse(Files.readString(strategyFile)));
            if (strategy.isEmpty()) {
                System.err.println("Not realizable");
                return NOT_REALIZABLE;
            }

            Stopwatch stopwatch = Stopwatch.createStarted();
            Optional<Automaton> patched = new LocalPatcher(engine)
                .unreachableCellDiscrete(spec, strategy.get(), world, blocked, radius, nonmetric, nonbool);
            log.log(Level.INFO, () -> "Patching took %s".formatted(stopwatch));
            if (patched.isEmpty()) {
                System.err.println("Patching failed with radius " + radius);
                return NOT_REALIZABLE;
            }
            log.log(Level.INFO, () -> "Original strategy size: %d, patched: %d".formatted(
                strategy.get().size(), patched.get().size()));
            write(output, patched.get(), spec, format);
            return 0;
        }
    }
}
