package com.ratings.adapter.format;

import com.ratings.engine.model.GameResult;
import com.ratings.engine.model.RatingChange;
import com.ratings.engine.stats.RatingHistogram;
import com.ratings.engine.stats.Standing;
import com.ratings.engine.stats.TournamentSummary;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Plain-text tournament report: standings, round-by-round results, unrated
 * entrants and a histogram of the new ratings.
 */
@Component
public class TextReportWriter implements ReportWriter {

    private static final String ROW_FORMAT = "%-5s %-24s %-9s %7s %8s %8s %7s %6s%n";
    private static final int HISTOGRAM_WIDTH = 50;

    @Override
    public Set<String> extensions() {
        return Set.of("txt");
    }

    @Override
    public void write(RatingReport report, Writer out) throws IOException {
        PrintWriter printer = new PrintWriter(out);
        writeHeader(report, printer);
        writeStandings(report.standings(), printer);
        writeRounds(report.standings(), printer);
        writeUnrated(report.unratedEntrants(), printer);
        writeHistogram(report.histogram(), printer);
        printer.flush();
        if (printer.checkError()) {
            throw new IOException("Failed to write report");
        }
    }

    // ============ SECTIONS ============

    private static void writeHeader(RatingReport report, PrintWriter out) {
        TournamentSummary summary = report.summary();
        out.println(report.info().name());
        out.println(report.info().date());
        out.printf("%d players (%d rated, %d unrated), %d games, average change %s%n",
                summary.players(), summary.ratedPlayers(), summary.unratedPlayers(),
                summary.games(), summary.getAverageChangeFormatted());
        out.println();
    }

    private static void writeStandings(List<Standing> standings, PrintWriter out) {
        out.printf(ROW_FORMAT, "RANK", "NAME", "RECORD", "SPREAD", "OLD RAT", "NEW RAT", "CHANGE", "PERF");
        for (Standing standing : standings) {
            RatingChange change = standing.change();
            out.printf(ROW_FORMAT,
                    standing.getRankFormatted(),
                    standing.getName(),
                    standing.record().getRecordFormatted(),
                    standing.record().getSpread(),
                    orDash(change.getOldRating()),
                    orDash(change.getNewRating()),
                    change.getDeltaFormatted(),
                    orDash(change.getPerformanceRating()));
        }
        out.println();
    }

    private static void writeRounds(List<Standing> standings, PrintWriter out) {
        out.println("Results by round");
        for (Standing standing : standings) {
            String name = standing.getName();
            out.println(name);
            for (GameResult game : standing.record().getGames()) {
                out.printf("  %s%n", describe(game, name));
            }
        }
        out.println();
    }

    private static void writeUnrated(List<Standing> unrated, PrintWriter out) {
        if (unrated.isEmpty()) {
            return;
        }
        for (Standing standing : unrated) {
            out.printf("%-24s is unrated%n", standing.getName());
        }
        out.println();
    }

    private static void writeHistogram(RatingHistogram histogram, PrintWriter out) {
        if (histogram.isEmpty()) {
            return;
        }
        out.println("Rating distribution");
        int max = histogram.getBins().values().stream().mapToInt(Integer::intValue).max().orElse(1);
        for (Map.Entry<Integer, Integer> bin : histogram.getBins().entrySet()) {
            int bar = Math.max(1, bin.getValue() * HISTOGRAM_WIDTH / max);
            out.printf("%5d-%-5d %3d %s%n",
                    bin.getKey(), bin.getKey() + histogram.getBinWidth() - 1, bin.getValue(), "#".repeat(bar));
        }
    }

    // ============ HELPER METHODS ============

    /**
     * One game from the given player's side, e.g. {@code R1 W Bertie Wooster 500-450}.
     */
    static String describe(GameResult game, String player) {
        double points = game.pointsFor(player);
        String result = points == 1.0 ? "W" : points == 0.0 ? "L" : "D";
        StringBuilder line = new StringBuilder();
        if (game.round() > 0) {
            line.append('R').append(game.round()).append(' ');
        }
        line.append(result).append(' ').append(game.opponentOf(player));
        if (game.hasScores()) {
            boolean first = player.equals(game.playerA());
            int own = first ? game.scoreA() : game.scoreB();
            int theirs = first ? game.scoreB() : game.scoreA();
            line.append(' ').append(own).append('-').append(theirs);
        }
        return line.toString();
    }

    private static String orDash(Integer value) {
        return value != null ? value.toString() : "-";
    }
}
