package com.questrail.lockcodec.error;

/**
 * Raised when a codec operation runs before any charset table was installed.
 */
public final class TableNotInitializedException extends LockCodecException
{
    public TableNotInitializedException() {
        super(Category.CONFIGURATION, "No charset table has been installed");
    }
}
