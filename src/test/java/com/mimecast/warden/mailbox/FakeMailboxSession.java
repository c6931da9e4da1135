package com.mimecast.warden.mailbox;

import com.mimecast.warden.exception.TransportException;
import com.mimecast.warden.exception.UnsupportedCapabilityException;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Date;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory mailbox session recording every operation in order.
 * <p>Operations are recorded as {@code search}, {@code fetch}, {@code store (flags)}, {@code copy folder},
 * <br>{@code expunge}, {@code append folder} and {@code idle}.
 */
public class FakeMailboxSession implements MailboxSession {

    private final List<String> operations;
    private final Map<Long, byte[]> messages = new LinkedHashMap<>();
    private final Map<String, List<Long>> searchResults = new HashMap<>();
    private final Set<String> failing = new HashSet<>();
    private final Set<String> throwing = new HashSet<>();
    private final Deque<MailboxResponse<String>> notifications = new ArrayDeque<>();
    private final List<byte[]> appended = new ArrayList<>();
    private List<Long> defaultSearch = new ArrayList<>();
    private boolean idleSupported = true;
    private boolean closed;

    public FakeMailboxSession() {
        this(new ArrayList<>());
    }

    /**
     * Constructs a new FakeMailboxSession sharing an operation log.
     *
     * @param operations Operation log, shared with other recorders to check ordering.
     */
    public FakeMailboxSession(List<String> operations) {
        this.operations = operations;
    }

    public FakeMailboxSession addMessage(long uid, byte[] raw) {
        messages.put(uid, raw);
        return this;
    }

    public FakeMailboxSession onSearch(String query, Long... uids) {
        searchResults.put(query, List.of(uids));
        return this;
    }

    public FakeMailboxSession onAnySearch(Long... uids) {
        defaultSearch = List.of(uids);
        return this;
    }

    /**
     * Makes an operation answer NO.
     *
     * @param operation Operation name, for example {@code copy}.
     * @return Self.
     */
    public FakeMailboxSession fail(String operation) {
        failing.add(operation);
        return this;
    }

    /**
     * Makes an operation throw a transport failure.
     *
     * @param operation Operation name.
     * @return Self.
     */
    public FakeMailboxSession breakOn(String operation) {
        throwing.add(operation);
        return this;
    }

    public FakeMailboxSession notifyChange(String status) {
        notifications.add(MailboxResponse.ok(status));
        return this;
    }

    public FakeMailboxSession idleTimeout() {
        notifications.add(MailboxResponse.ok(null));
        return this;
    }

    public FakeMailboxSession withoutIdle() {
        idleSupported = false;
        return this;
    }

    public List<String> getOperations() {
        return operations;
    }

    public List<byte[]> getAppended() {
        return appended;
    }

    public boolean isClosed() {
        return closed;
    }

    public long count(String prefix) {
        return operations.stream().filter(o -> o.startsWith(prefix)).count();
    }

    private <T> MailboxResponse<T> answer(String operation, String record, T data) throws TransportException {
        operations.add(record);
        if (throwing.contains(operation)) {
            throw new TransportException(operation + " connection reset");
        }
        if (failing.contains(operation)) {
            return MailboxResponse.no(operation + " refused");
        }
        return MailboxResponse.ok(data);
    }

    @Override
    public MailboxResponse<List<Long>> search(String query) throws TransportException {
        return answer("search", "search " + query, searchResults.getOrDefault(query, defaultSearch));
    }

    @Override
    public MailboxResponse<List<FetchedMessage>> fetch(List<Long> uids) throws TransportException {
        List<FetchedMessage> fetched = new ArrayList<>();
        for (Long uid : uids) {
            if (messages.containsKey(uid)) {
                fetched.add(new FetchedMessage(uid, messages.get(uid)));
            }
        }
        return answer("fetch", "fetch " + uids, fetched);
    }

    @Override
    public MailboxResponse<Void> storeFlags(List<Long> uids, String flags) throws TransportException {
        return answer("store", "store " + flags, null);
    }

    @Override
    public MailboxResponse<Void> copy(List<Long> uids, String folder) throws TransportException {
        return answer("copy", "copy " + folder, null);
    }

    @Override
    public MailboxResponse<Void> expunge() throws TransportException {
        return answer("expunge", "expunge", null);
    }

    @Override
    public MailboxResponse<Void> append(String folder, String flags, Date time, byte[] raw) throws TransportException {
        MailboxResponse<Void> response = answer("append", "append " + folder, null);
        if (response.isOk()) {
            appended.add(raw);
        }
        return response;
    }

    @Override
    public MailboxResponse<String> waitForChange(Duration timeout) throws TransportException {
        operations.add("idle");
        if (throwing.contains("idle")) {
            throw new TransportException("idle connection reset");
        }
        MailboxResponse<String> next = notifications.poll();
        return next != null ? next : MailboxResponse.no("BYE");
    }

    @Override
    public void requireChangeNotification() throws UnsupportedCapabilityException {
        if (!idleSupported) {
            throw new UnsupportedCapabilityException("IDLE");
        }
    }

    @Override
    public void close() {
        closed = true;
    }
}
