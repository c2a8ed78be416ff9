package ch.so.arp.nexa.error;

/**
 * A vector does not match the dimension of the index it is used with. The
 * index has to be rebuilt with a matching embedding model.
 */
public class IndexIncompatibleException extends RagException {

    private final int expectedDimension;
    private final int actualDimension;

    public IndexIncompatibleException(int expectedDimension, int actualDimension) {
        super(ErrorCode.INDEX_INCOMPATIBLE, "Vector dimension " + actualDimension
                + " does not match index dimension " + expectedDimension, null);
        this.expectedDimension = expectedDimension;
        this.actualDimension = actualDimension;
    }

    public int getExpectedDimension() {
        return expectedDimension;
    }

    public int getActualDimension() {
        return actualDimension;
    }
}
