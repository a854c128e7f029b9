package io.github.mandar2812.imagcdf.container;

/**
 * Defines a data compression type that a container may apply to a
 * newly created dataset.
 *
 * @author   mandar2812
 * @since    14 Oct 2026
 */
public class Compression {

    /** No compression. */
    public static final Compression NONE = new Compression( "NONE", 0, 0 );

    /** Run length encoding of zeros. */
    public static final Compression RLE = new Compression( "RLE", 1, 0 );

    /** Huffman encoding with optimal encoding trees. */
    public static final Compression HUFF = new Compression( "HUFF", 2, 0 );

    /** Adaptive Huffman encoding with optimal encoding trees. */
    public static final Compression AHUFF = new Compression( "AHUFF", 3, 0 );

    private static final Compression[] GZIPS = createGzips();

    private final String name_;
    private final int cType_;
    private final int level_;

    /**
     * Constructor.
     *
     * @param   name   compression format name
     * @param   cType  CDF compression type code
     * @param   level  compression level, or 0 if not applicable
     */
    private Compression( String name, int cType, int level ) {
        name_ = name;
        cType_ = cType;
        level_ = level;
    }

    /**
     * Returns the gzip compression for a given level.
     *
     * @param  level  compression level, 1 (fastest) to 9 (smallest)
     * @return  compression object
     * @throws IllegalArgumentException  if level is out of range
     */
    public static Compression gzip( int level ) {
        if ( level < 1 || level > 9 ) {
            throw new IllegalArgumentException( "Gzip level " + level
                                              + " not in range 1-9" );
        }
        return GZIPS[ level - 1 ];
    }

    /**
     * Returns this compression format's name.
     *
     * @return  name, for instance "RLE" or "GZIP6"
     */
    public String getName() {
        return name_;
    }

    /**
     * Returns the CDF compression type code.
     * The mapping, from cdf.h, is
     * NONE=0, RLE=1, HUFF=2, AHUFF=3, GZIP=5.
     *
     * @return  cType code
     */
    public int getType() {
        return cType_;
    }

    /**
     * Returns the compression level parameter.
     *
     * @return  gzip level, or 0 for other formats
     */
    public int getLevel() {
        return level_;
    }

    @Override
    public String toString() {
        return name_;
    }

    private static Compression[] createGzips() {
        Compression[] gzips = new Compression[ 9 ];
        for ( int i = 0; i < 9; i++ ) {
            gzips[ i ] = new Compression( "GZIP" + ( i + 1 ), 5, i + 1 );
        }
        return gzips;
    }
}
