package io.github.mandar2812.imagcdf.container;

/**
 * How a container factory should treat the dataset at a given path.
 *
 * @author   mandar2812
 * @since    14 Oct 2026
 */
public enum OpenMode {

    /** Create the dataset, deleting any existing one. */
    FORCE_CREATE,

    /** Create the dataset; an existing one is an error. */
    CREATE,

    /** Open an existing dataset. */
    OPEN;
}
