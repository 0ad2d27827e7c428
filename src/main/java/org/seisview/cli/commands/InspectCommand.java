package org.seisview.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Arrays;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.seisview.cli.CommandLineInterface;
import org.seisview.segy.SegyException;
import org.seisview.segy.slice.Slice;
import org.seisview.segy.slice.SliceAxis;
import org.seisview.segy.volume.VolumeAccessor;
import org.seisview.segy.volume.VolumeMetadata;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Opens a SEG-Y file offline and prints its metadata, optionally with statistics of one slice.
 */
@Command(
    name = "inspect",
    description = "Print metadata of a SEG-Y file and optional slice statistics"
)
public class InspectCommand implements Callable<Integer> {

    static class SliceOptions {
        @Option(names = {"--inline"}, description = "Inline number to extract")
        Integer inline;

        @Option(names = {"--crossline"}, description = "Crossline number to extract")
        Integer crossline;
    }

    @Parameters(index = "0", description = "SEG-Y file to inspect")
    private File file;

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    SliceOptions sliceOptions;

    @Option(names = {"--textual-header"}, description = "Print the full textual header")
    private boolean printTextualHeader;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        if (!file.isFile()) {
            err.println("Error: file not found: " + file.getAbsolutePath());
            return 1;
        }

        try (VolumeAccessor accessor = VolumeAccessor.fromConfig(parent.getConfig().getConfig("seisview.volume"))) {
            final VolumeMetadata metadata = accessor.open(file.toPath());
            printMetadata(out, metadata);

            if (sliceOptions != null) {
                final SliceAxis axis = sliceOptions.inline != null ? SliceAxis.INLINE : SliceAxis.CROSSLINE;
                final int value = sliceOptions.inline != null ? sliceOptions.inline : sliceOptions.crossline;
                printSliceStatistics(out, accessor.rawSlice(axis, value), accessor.slice(axis, value));
            }
            out.flush();
            return 0;
        } catch (SegyException e) {
            err.println("Error [" + e.getErrorCode() + "]: " + e.getMessage());
            return 2;
        } catch (IOException e) {
            err.println("Error: cannot read " + file + ": " + e.getMessage());
            return 1;
        }
    }

    private void printMetadata(final PrintWriter out, final VolumeMetadata metadata) {
        out.println("File:              " + file.getAbsolutePath());
        out.println("Revision:          " + metadata.revision());
        out.println("Sample format:     " + metadata.sampleFormat() + " (code " + metadata.sampleFormat().code() + ")");
        out.println("Samples/trace:     " + metadata.samplesPerTrace());
        out.println("Sample interval:   " + (metadata.sampleIntervalMicros().isPresent()
            ? metadata.sampleIntervalMicros().getAsInt() + " us" : "undefined"));
        out.println("Traces:            " + metadata.traceCount());
        out.println("Inlines:           " + describeRange(metadata.inlines()));
        out.println("Crosslines:        " + describeRange(metadata.crosslines()));
        if (metadata.duplicatePositions() > 0) {
            out.println("Duplicate traces:  " + metadata.duplicatePositions());
        }
        if (printTextualHeader) {
            out.println();
            out.println(metadata.textualHeader());
        }
    }

    private static String describeRange(final int[] values) {
        return values.length + " [" + values[0] + " .. " + values[values.length - 1] + "]";
    }

    private static void printSliceStatistics(final PrintWriter out, final Slice raw, final Slice normalized) {
        out.println();
        out.println(raw.getAxis().label() + " " + raw.getAxisValue() + ": "
            + raw.getSampleCount() + " samples x " + raw.getWidth() + " traces");
        final double[] rawStats = statistics(raw);
        final double[] normalizedStats = statistics(normalized);
        out.printf(Locale.ROOT, "Raw amplitude:     min %.6g, max %.6g, mean %.6g%n", rawStats[0], rawStats[1], rawStats[2]);
        out.printf(Locale.ROOT, "Normalized:        min %.4f, max %.4f, mean %.4f%n",
            normalizedStats[0], normalizedStats[1], normalizedStats[2]);
    }

    /**
     * @return min, max and mean over finite values, NaN when there are none
     */
    static double[] statistics(final Slice slice) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0;
        long count = 0;
        for (float[] row : slice.getRows()) {
            for (float value : row) {
                if (Float.isFinite(value)) {
                    min = Math.min(min, value);
                    max = Math.max(max, value);
                    sum += value;
                    count++;
                }
            }
        }
        if (count == 0) {
            final double[] empty = new double[3];
            Arrays.fill(empty, Double.NaN);
            return empty;
        }
        return new double[] {min, max, sum / count};
    }
}
