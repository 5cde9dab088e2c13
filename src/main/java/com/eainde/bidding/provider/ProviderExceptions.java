package com.eainde.bidding.provider;

import com.eainde.bidding.error.BiddingPipelineException;
import com.eainde.bidding.error.PermanentProviderException;
import com.eainde.bidding.error.TransientProviderException;
import dev.langchain4j.exception.NonRetriableException;

/**
 * Maps vendor exceptions onto the pipeline's transient/permanent split.
 */
public final class ProviderExceptions {

    private ProviderExceptions() {
    }

    /**
     * Exceptions already in the pipeline hierarchy pass through. langchain4j's
     * {@link NonRetriableException} family (authentication, invalid request, model not found)
     * becomes permanent; everything else is treated as transient.
     */
    public static BiddingPipelineException translate(String provider, RuntimeException e) {
        if (e instanceof BiddingPipelineException pipelineException) {
            return pipelineException;
        }
        String message = provider + " call failed: " + e.getMessage();
        if (e instanceof NonRetriableException || e instanceof IllegalArgumentException) {
            return new PermanentProviderException(message, e);
        }
        return new TransientProviderException(message, e);
    }
}
