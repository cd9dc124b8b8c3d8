package com.questrail.lockcodec.error;

/**
 * Raised when a code group contains anything other than ASCII {@code 0-9}.
 */
public final class MalformedDigitsException extends LockCodecException
{
    private final String group;
    private final int groupIndex;

    public MalformedDigitsException(String group, int groupIndex) {
        super(Category.INPUT_FORMAT, "Group " + groupIndex + " '" + group + "' is not a decimal number");
        this.group = group;
        this.groupIndex = groupIndex;
    }

    public String group() {
        return group;
    }

    public int groupIndex() {
        return groupIndex;
    }
}
