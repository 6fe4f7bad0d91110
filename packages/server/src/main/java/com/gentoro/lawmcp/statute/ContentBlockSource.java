package com.gentoro.lawmcp.statute;

import java.util.List;

/**
 * Normalizes a raw structured document, however it was obtained, into the ordered block sequence
 * that {@link DocumentStructurer} consumes.
 *
 * @param <D> raw document type (an HTML DOM for the laws database)
 */
@FunctionalInterface
public interface ContentBlockSource<D> {

  /**
   * @throws com.gentoro.lawmcp.exception.StructuralException when the document has no content root
   */
  List<ContentBlock> nextBlocks(D rawDocument);
}
