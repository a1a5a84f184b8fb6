package com.chemdata.dwar.decode;

import java.util.List;

/**
 * Boundary to the engine that turns structure identifiers into notation strings.
 *
 * Implementations answer with one line per resolved item, shaped
 * {@code <index>:<result>} where {@code index} points into {@code identifiers} and
 * a result starting with {@code ERROR:} marks a failed item. Lines may come in
 * any order.
 */
@FunctionalInterface
public interface StructureDecoder {

    /**
     * @param identifiers non-blank identifiers, submitted as one batch
     * @return the raw response lines
     * @throws DecoderException when the batch as a whole could not be decoded
     */
    List<String> decodeBatch(List<String> identifiers) throws DecoderException;
}
