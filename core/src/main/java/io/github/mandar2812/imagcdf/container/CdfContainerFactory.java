package io.github.mandar2812.imagcdf.container;

import java.io.File;
import java.io.IOException;

/**
 * Opens or creates datasets in some container engine.
 *
 * @author   mandar2812
 * @since    14 Oct 2026
 */
public interface CdfContainerFactory {

    /**
     * Opens a dataset.
     * The returned session must be closed after writing,
     * or the dataset may be left incomplete.
     *
     * @param  file   dataset location
     * @param  mode   whether to create or open the dataset
     * @param  compression  compression for a created dataset;
     *                      ignored when opening an existing one
     * @return   open session
     * @throws ContainerException  if the engine refuses
     */
    CdfContainer open( File file, OpenMode mode, Compression compression )
            throws IOException;
}
