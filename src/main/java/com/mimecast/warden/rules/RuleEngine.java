package com.mimecast.warden.rules;

import com.mimecast.warden.dedup.DedupWindow;
import com.mimecast.warden.exception.SearchFailedException;
import com.mimecast.warden.exception.TransportException;
import com.mimecast.warden.mailbox.MailboxResponse;
import com.mimecast.warden.mailbox.MailboxSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Set;

/**
 * Runs one pass of the rule table.
 * <p>
 * Rules run in table order. A failing pipeline only ends its own rule; a failing search ends the pass
 * <br>and is reported as a transport failure.
 * <p>Each matching rule runs inside a dedup scope so handlers see everything handled earlier in the
 * <br>same wake-up and in the previous one, while only new identifiers are kept as current.
 */
public class RuleEngine {
    private static final Logger log = LogManager.getLogger(RuleEngine.class);

    private final RuleTable ruleTable;
    private final PipelineRunner pipelineRunner;

    public RuleEngine(RuleTable ruleTable, PipelineRunner pipelineRunner) {
        this.ruleTable = ruleTable;
        this.pipelineRunner = pipelineRunner;
    }

    /**
     * Runs every rule once.
     *
     * @param session Mailbox session.
     * @param window  Dedup window, already rotated for this wake-up.
     * @throws SearchFailedException A search returned a non-OK status.
     * @throws TransportException    Connection failure.
     */
    public void runPass(MailboxSession session, DedupWindow window) throws TransportException {
        for (Rule rule : ruleTable) {
            MailboxResponse<List<Long>> response = session.search(rule.getQuery());
            if (!response.isOk()) {
                throw new SearchFailedException(rule.getQuery(), "Search for rule " + rule.getName() + " failed: " + response.getText());
            }

            List<Long> uids = response.getData();
            if (uids == null || uids.isEmpty()) {
                continue;
            }

            log.info("Rule {} matched {} message(s)", rule.getName(), uids.size());
            Set<String> seen = window.openRuleScope();
            try {
                StepResult result = pipelineRunner.run(session, uids, rule.getSteps(), seen);
                seen = result.getSeen();
            } finally {
                window.closeRuleScope(seen);
            }
        }
    }

    public RuleTable getRuleTable() {
        return ruleTable;
    }
}
