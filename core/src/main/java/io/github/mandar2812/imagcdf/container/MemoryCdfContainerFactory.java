package io.github.mandar2812.imagcdf.container;

import java.io.File;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Container factory whose datasets live in memory, keyed by path.
 * Datasets persist between sessions for the lifetime of the factory,
 * so a dataset written by one session can be read back by another.
 *
 * @author   mandar2812
 * @since    14 Oct 2026
 */
public class MemoryCdfContainerFactory implements CdfContainerFactory {

    private final Map<String,MemoryCdfContainer.Dataset> datasets_;

    public static final CdfStatus CDF_EXISTS =
        new CdfStatus( -2010, "The CDF named already exists." );
    public static final CdfStatus NO_SUCH_CDF =
        new CdfStatus( -2011, "The specified CDF does not exist." );

    private static final Logger logger_ =
        Logger.getLogger( MemoryCdfContainerFactory.class.getName() );

    /**
     * Constructs a factory with no datasets.
     */
    public MemoryCdfContainerFactory() {
        datasets_ = new HashMap<String,MemoryCdfContainer.Dataset>();
    }

    public MemoryCdfContainer open( File file, OpenMode mode,
                                    Compression compression )
            throws ContainerException {
        String key = file.getPath();
        MemoryCdfContainer.Dataset dataset = datasets_.get( key );
        switch ( mode ) {
            case FORCE_CREATE:
                if ( dataset != null ) {
                    logger_.config( "Replacing existing dataset " + key );
                }
                dataset = new MemoryCdfContainer.Dataset( compression );
                datasets_.put( key, dataset );
                break;
            case CREATE:
                if ( dataset != null ) {
                    throw new ContainerException( CDF_EXISTS );
                }
                dataset = new MemoryCdfContainer.Dataset( compression );
                datasets_.put( key, dataset );
                break;
            case OPEN:
                if ( dataset == null ) {
                    throw new ContainerException( NO_SUCH_CDF );
                }
                break;
            default:
                throw new AssertionError( mode );
        }
        return new MemoryCdfContainer( key, dataset );
    }

    /**
     * Indicates whether a dataset exists at a given path.
     *
     * @param  file  dataset location
     * @return  true iff a dataset has been created there
     */
    public boolean exists( File file ) {
        return datasets_.containsKey( file.getPath() );
    }
}
