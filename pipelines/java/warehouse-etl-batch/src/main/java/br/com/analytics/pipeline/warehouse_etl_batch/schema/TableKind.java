package br.com.analytics.pipeline.warehouse_etl_batch.schema;

public enum TableKind {

    DIMENSION("dims"),
    FACT("facts");

    private final String directory;

    TableKind(String directory) {
        this.directory = directory;
    }

    /**
     * Sub-directory of the silver area holding tables of this kind.
     */
    public String directory() {
        return directory;
    }
}
