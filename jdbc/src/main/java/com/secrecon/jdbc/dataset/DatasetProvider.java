package com.secrecon.jdbc.dataset;

import com.secrecon.loader.DatasetLoader;
import com.secrecon.loader.LoaderException;
import com.secrecon.loader.LoaderResult;
import java.nio.file.Path;
import java.util.Objects;

/** Shared entry point for loading a dataset directory, used by the driver and the schema factory. */
public final class DatasetProvider {

    private DatasetProvider() {}

    public static LoaderResult load(Path datasetDir) throws LoaderException {
        Objects.requireNonNull(datasetDir, "datasetDir");
        return new DatasetLoader().load(datasetDir);
    }
}
