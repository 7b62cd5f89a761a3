package com.leyesmx.application.conversion;

/**
 * Batch conversion settings ({@code conversion.batch.*}).
 *
 * @param inputDir    directory of cleaned statute texts; blank disables the startup batch
 * @param outputDir   root of the json/, logs.txt and index.json outputs
 * @param fileGlob    input file name pattern
 * @param parallelism number of documents parsed at once
 */
public record BatchSettings(
        String inputDir,
        String outputDir,
        String fileGlob,
        int parallelism
) {
    public boolean hasInputDir() {
        return inputDir != null && !inputDir.isBlank();
    }
}
