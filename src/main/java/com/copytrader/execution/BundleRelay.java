package com.copytrader.execution;

import com.copytrader.domain.enums.SubmissionPath;

/**
 * An execution-acceleration relay that lands tipped transactions ahead of the public
 * mempool-less path.
 */
public interface BundleRelay {

    String name();

    SubmissionPath path();

    /**
     * @return the relay's acknowledgement, a bundle id or the transaction signature
     */
    String submit(SignedTransaction transaction);
}
