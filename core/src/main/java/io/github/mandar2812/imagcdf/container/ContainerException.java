package io.github.mandar2812.imagcdf.container;

import java.io.IOException;

/**
 * Exception thrown by a container engine when an operation fails.
 * It carries the engine's native status.
 *
 * @author   mandar2812
 * @since    14 Oct 2026
 */
public class ContainerException extends IOException {

    private final CdfStatus status_;

    /**
     * Constructs an exception from a failure status.
     *
     * @param  status  engine status
     */
    public ContainerException( CdfStatus status ) {
        super( status.toMessage() );
        status_ = status;
    }

    /**
     * Constructs an exception from a failure status and a cause.
     *
     * @param  status  engine status
     * @param  cause   upstream exception
     */
    public ContainerException( CdfStatus status, Throwable cause ) {
        super( status.toMessage() );
        initCause( cause );
        status_ = status;
    }

    /**
     * Returns the status that caused this exception.
     *
     * @return  engine status
     */
    public CdfStatus getStatus() {
        return status_;
    }
}
