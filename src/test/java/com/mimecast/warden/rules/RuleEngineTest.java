package com.mimecast.warden.rules;

import com.mimecast.warden.dedup.DedupWindow;
import com.mimecast.warden.exception.SearchFailedException;
import com.mimecast.warden.exception.TransportException;
import com.mimecast.warden.handlers.ContentHandler;
import com.mimecast.warden.handlers.ContentHandlerKind;
import com.mimecast.warden.mailbox.FakeMailboxSession;
import com.mimecast.warden.query.Query;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.Mockito.*;

class RuleEngineTest {

    private static final String SPAM = Query.match(Query.froms("spam"));
    private static final String WORK = Query.match(Query.froms("work"));

    private RuleEngine engine(RuleTable table) {
        return new RuleEngine(table, new PipelineRunner(null, () -> false));
    }

    @Test
    void testRulesRunInOrderAndSkipEmptyMatches() throws Exception {
        FakeMailboxSession session = new FakeMailboxSession()
                .onSearch(SPAM)
                .onSearch(WORK, 7L);
        RuleTable table = RuleTable.builder()
                .rule("spam", Query.root(Query.froms("spam")), HandlerStep.delete())
                .rule("work", Query.root(Query.froms("work")), HandlerStep.copy("Work"))
                .build();

        engine(table).runPass(session, new DedupWindow());

        assertEquals(List.of("search " + SPAM, "search " + WORK, "copy Work"), session.getOperations());
    }

    @Test
    void testFailingPipelineDoesNotStopLaterRules() throws Exception {
        FakeMailboxSession session = new FakeMailboxSession().onAnySearch(1L).fail("copy");
        RuleTable table = RuleTable.builder()
                .rule("first", Query.root(Query.froms("spam")), HandlerStep.copy("A"), HandlerStep.expunge())
                .rule("second", Query.root(Query.froms("work")), HandlerStep.delete())
                .build();

        engine(table).runPass(session, new DedupWindow());

        assertEquals(List.of("search " + SPAM, "copy A", "search " + WORK, "store (\\Deleted)"), session.getOperations());
    }

    @Test
    void testSearchFailureAbortsPass() {
        FakeMailboxSession session = new FakeMailboxSession().fail("search");
        RuleTable table = RuleTable.builder()
                .rule("first", Query.root(Query.froms("spam")), HandlerStep.delete())
                .rule("second", Query.root(Query.froms("work")), HandlerStep.delete())
                .build();

        SearchFailedException e = assertThrows(SearchFailedException.class, () -> engine(table).runPass(session, new DedupWindow()));

        assertEquals(SPAM, e.getQuery());
        assertEquals(1, session.count("search"));
    }

    @Test
    void testScopeSeededWithWindowAndNewIdsKept() throws Exception {
        DedupWindow window = new DedupWindow();
        Set<String> first = window.openRuleScope();
        first.add("<old>");
        window.closeRuleScope(first);
        window.rotate();

        ContentHandler handler = mock(ContentHandler.class);
        when(handler.getKind()).thenReturn(ContentHandlerKind.AUTO_FORWARD_REPLY);
        when(handler.handle(any(), anyList(), anySet(), any())).thenAnswer(invocation -> {
            Set<String> seen = invocation.getArgument(2);
            assertTrue(seen.contains("<old>"));
            seen.add("<new>");
            return new StepResult(StepStatus.OK, null, seen);
        });

        FakeMailboxSession session = new FakeMailboxSession().onAnySearch(1L);
        RuleTable table = RuleTable.builder()
                .rule("work", Query.root(Query.froms("work")), HandlerStep.content(handler))
                .build();

        engine(table).runPass(session, window);

        assertEquals(Set.of("<new>"), window.getCurrent());
        assertEquals(Set.of("<old>"), window.getPrevious());
    }

    @Test
    void testScopeClosedWhenPipelineBreaks() throws Exception {
        ContentHandler handler = mock(ContentHandler.class);
        when(handler.getKind()).thenReturn(ContentHandlerKind.AUTO_FORWARD_REPLY);
        when(handler.handle(any(), anyList(), anySet(), any())).thenAnswer(invocation -> {
            Set<String> seen = invocation.getArgument(2);
            seen.add("<sent>");
            throw new TransportException("reset");
        });

        DedupWindow window = new DedupWindow();
        FakeMailboxSession session = new FakeMailboxSession().onAnySearch(1L);
        RuleTable table = RuleTable.builder()
                .rule("work", Query.root(Query.froms("work")), HandlerStep.content(handler))
                .build();

        assertThrows(TransportException.class, () -> engine(table).runPass(session, window));
        assertTrue(window.isHandled("<sent>"));
    }
}
