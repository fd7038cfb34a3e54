package com.parallel.wordflux.cli;

import com.parallel.wordflux.WordCount;

import org.knowm.xchart.BitmapEncoder;
import org.knowm.xchart.CategoryChart;
import org.knowm.xchart.CategoryChartBuilder;
import org.knowm.xchart.style.Styler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class ChartGenerator {

    private ChartGenerator() {
    }

    public static void exportTopWordsChart(List<WordCount> ranking, Path outputFile) throws IOException {
        if (ranking.isEmpty()) {
            return;
        }
        if (outputFile.getParent() != null) {
            Files.createDirectories(outputFile.getParent());
        }

        List<String> words = new ArrayList<>(ranking.size());
        List<Long> counts = new ArrayList<>(ranking.size());
        for (WordCount wc : ranking) {
            words.add(wc.word());
            counts.add(wc.count());
        }

        CategoryChart chart = new CategoryChartBuilder()
                .width(1100)
                .height(650)
                .title("Most frequent words")
                .xAxisTitle("Word")
                .yAxisTitle("Occurrences")
                .build();

        chart.getStyler().setLegendVisible(false);
        chart.getStyler().setLegendPosition(Styler.LegendPosition.InsideNE);
        chart.getStyler().setAvailableSpaceFill(0.8);
        chart.getStyler().setXAxisLabelRotation(45);

        chart.addSeries("occurrences", words, counts);

        BitmapEncoder.saveBitmap(chart, outputFile.toString(), BitmapEncoder.BitmapFormat.PNG);
    }
}
