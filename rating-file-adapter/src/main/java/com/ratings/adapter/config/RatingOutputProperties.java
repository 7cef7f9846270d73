package com.ratings.adapter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Output file names, bound from {@code rating.output.*}. The writer for each
 * file is chosen by its extension.
 */
@ConfigurationProperties(prefix = "rating.output")
public class RatingOutputProperties {

    private String directory = ".";
    private String reportFile = "ratings-report.txt";
    private String tableFile = "ratings.csv";
    private String ratingListFile = "";     // empty disables the updated rating list
    private int inactiveAfterDays = 0;      // 0 keeps idle players on the updated list
    private String resultsFile = "";        // empty disables the converted result file
    private int histogramBin = 100;

    public boolean isRatingListEnabled() {
        return ratingListFile != null && !ratingListFile.isBlank();
    }

    public boolean isResultsFileEnabled() {
        return resultsFile != null && !resultsFile.isBlank();
    }

    public String getDirectory() { return directory; }
    public void setDirectory(String directory) { this.directory = directory; }

    public String getReportFile() { return reportFile; }
    public void setReportFile(String reportFile) { this.reportFile = reportFile; }

    public String getTableFile() { return tableFile; }
    public void setTableFile(String tableFile) { this.tableFile = tableFile; }

    public String getRatingListFile() { return ratingListFile; }
    public void setRatingListFile(String ratingListFile) { this.ratingListFile = ratingListFile; }

    public int getInactiveAfterDays() { return inactiveAfterDays; }
    public void setInactiveAfterDays(int inactiveAfterDays) { this.inactiveAfterDays = inactiveAfterDays; }

    public String getResultsFile() { return resultsFile; }
    public void setResultsFile(String resultsFile) { this.resultsFile = resultsFile; }

    public int getHistogramBin() { return histogramBin; }
    public void setHistogramBin(int histogramBin) { this.histogramBin = histogramBin; }
}
