package org.bpmnml.language.model;

import java.util.List;

/**
 * A named Pool or Lane holding an ordered sequence of elements.
 */
public interface Container extends ModelElement {

    String getName();

    List<PoolElement> getElements();
}
