package com.example.pipelines.eviction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * LRU ordering kept as a doubly linked list over an arena of slots.
 *
 * <p>Nodes live in parallel arrays addressed by slot index; {@code prev}/{@code next} hold
 * indices rather than references and released slots are threaded onto a free list for reuse.
 * The head is the most recently used key, the tail is the next victim.
 */
public class LruEvictionStrategy implements EvictionStrategy {

    private static final int NIL = -1;

    private final Map<String, Integer> slotByKey = new HashMap<>();

    private String[] keys;
    private int[] prev;
    private int[] next;

    private int head = NIL;
    private int tail = NIL;

    // Free slots are chained through next[].
    private int freeHead = NIL;
    private int allocated;

    public LruEvictionStrategy() {
        this(16);
    }

    public LruEvictionStrategy(int initialSlots) {
        int n = Math.max(1, initialSlots);
        this.keys = new String[n];
        this.prev = new int[n];
        this.next = new int[n];
    }

    @Override
    public void onHit(String key) {
        Integer slot = slotByKey.get(key);
        if (slot != null) {
            moveToFront(slot);
        }
    }

    @Override
    public void onInsert(String key) {
        Integer existing = slotByKey.get(key);
        if (existing != null) {
            moveToFront(existing);
            return;
        }
        int slot = allocate();
        keys[slot] = key;
        slotByKey.put(key, slot);
        linkAtHead(slot);
    }

    @Override
    public void onRemove(String key) {
        Integer slot = slotByKey.remove(key);
        if (slot != null) {
            unlink(slot);
            release(slot);
        }
    }

    @Override
    public Optional<String> selectVictim() {
        if (tail == NIL) {
            return Optional.empty();
        }
        int victim = tail;
        String key = keys[victim];
        slotByKey.remove(key);
        unlink(victim);
        release(victim);
        return Optional.of(key);
    }

    @Override
    public void clear() {
        slotByKey.clear();
        Arrays.fill(keys, null);
        head = NIL;
        tail = NIL;
        freeHead = NIL;
        allocated = 0;
    }

    @Override
    public int size() {
        return slotByKey.size();
    }

    /** Keys from most to least recently used. */
    public List<String> recencyOrder() {
        List<String> out = new ArrayList<>(slotByKey.size());
        for (int i = head; i != NIL; i = next[i]) {
            out.add(keys[i]);
        }
        return out;
    }

    /** Number of slots ever handed out; stays flat while released slots are reused. */
    public int allocatedSlots() {
        return allocated;
    }

    // --- arena helpers ---

    private int allocate() {
        if (freeHead != NIL) {
            int slot = freeHead;
            freeHead = next[slot];
            return slot;
        }
        if (allocated == keys.length) {
            int grown = keys.length * 2;
            keys = Arrays.copyOf(keys, grown);
            prev = Arrays.copyOf(prev, grown);
            next = Arrays.copyOf(next, grown);
        }
        return allocated++;
    }

    private void release(int slot) {
        keys[slot] = null;
        prev[slot] = NIL;
        next[slot] = freeHead;
        freeHead = slot;
    }

    private void linkAtHead(int slot) {
        prev[slot] = NIL;
        next[slot] = head;
        if (head != NIL) {
            prev[head] = slot;
        }
        head = slot;
        if (tail == NIL) {
            tail = slot;
        }
    }

    private void unlink(int slot) {
        int p = prev[slot];
        int n = next[slot];
        if (p != NIL) {
            next[p] = n;
        } else {
            head = n;
        }
        if (n != NIL) {
            prev[n] = p;
        } else {
            tail = p;
        }
        prev[slot] = NIL;
        next[slot] = NIL;
    }

    private void moveToFront(int slot) {
        if (slot == head) {
            return;
        }
        unlink(slot);
        linkAtHead(slot);
    }
}
