package org.caseview.codec;

/**
 * A {@code numpy.dtype} rebuilt from a pickle stream.
 * <p>
 * Only scalar numeric dtypes are meaningful here; the unpickler creates the
 * instance from the type code and then hands it the byte-order state.
 */
public final class PickledDtype {

    private final String code;
    private char byteOrder = '<';

    PickledDtype(String code) {
        this.code = code;
    }

    /**
     * Receives the dtype state tuple; element 1 is the byte-order character.
     * Called reflectively by the unpickler.
     */
    public void __setstate__(Object[] state) {
        if (state.length > 1 && state[1] instanceof String order && !order.isEmpty()) {
            byteOrder = order.charAt(0);
        }
    }

    public String code() {
        return code;
    }

    NpyArrayReader.ElementType elementType() {
        String normalized = code.length() > 0 && "<>|=".indexOf(code.charAt(0)) >= 0 ? code : byteOrder + code;
        if (normalized.length() == 2 && normalized.charAt(1) == '?') {
            normalized = normalized.charAt(0) + "b1";
        }
        return NpyArrayReader.ElementType.parse(normalized);
    }
}
