package com.secpipe.orchestrator.publish;

import java.util.List;

/**
 * What a publish call did: which page it wrote and which attachments made it.
 */
public record PublishReceipt(String pageId, boolean created,
                             List<String> uploaded, List<String> failed) {

    public boolean complete() {
        return failed.isEmpty();
    }
}
