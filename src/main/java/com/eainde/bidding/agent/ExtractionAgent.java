package com.eainde.bidding.agent;

import com.eainde.bidding.error.AgentTotalFailureException;
import com.eainde.bidding.model.NamespaceHandle;
import com.eainde.bidding.model.PartialExtractionResult;

/**
 * Extracts the fields of one {@link AgentSpec} from a namespace.
 *
 * <p>Implementations fail per field, not per agent: a field that cannot be extracted is
 * returned as unavailable while the other fields carry on. Only when every field is
 * unavailable does {@link #extract} throw {@link AgentTotalFailureException}. Implementations
 * must respond to interruption by stopping promptly.</p>
 */
public interface ExtractionAgent {

    AgentSpec spec();

    PartialExtractionResult extract(NamespaceHandle handle);
}
