package com.lineweave.core.buffer;

/**
 * {@code long} 特化的环形队列，用于保存可原地改写的宽度标注。
 *
 * <p>与 {@link RingBuffer} 语义相同。</p>
 */
public final class LongRingBuffer {
    private final long[] values;
    private final RingCursor cursor;

    public LongRingBuffer(int capacity) {
        this.cursor = new RingCursor(capacity);
        this.values = new long[capacity];
    }

    public int append(long value) {
        int slot = cursor.pushBack();
        values[slot] = value;
        return slot;
    }

    public long removeFirst() {
        return values[cursor.popFront()];
    }

    public long removeLast() {
        return values[cursor.popBack()];
    }

    public long peekFirst() {
        return values[cursor.front()];
    }

    public long peekLast() {
        return values[cursor.back()];
    }

    public long get(int offset) {
        return values[cursor.slotAt(offset)];
    }

    public void set(int offset, long value) {
        values[cursor.slotAt(offset)] = value;
    }

    public long getSlot(int slot) {
        return values[cursor.checkSlot(slot)];
    }

    public void setSlot(int slot, long value) {
        values[cursor.checkSlot(slot)] = value;
    }

    /** 在原值上累加 */
    public void addSlot(int slot, long delta) {
        values[cursor.checkSlot(slot)] += delta;
    }

    public int firstSlot() {
        return cursor.front();
    }

    public void clear() {
        cursor.clear();
    }

    public int size() {
        return cursor.size();
    }

    public boolean isEmpty() {
        return cursor.isEmpty();
    }

    public boolean isFull() {
        return cursor.isFull();
    }

    public int capacity() {
        return cursor.capacity();
    }
}
