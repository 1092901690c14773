package com.lineweave.core.buffer;

import java.util.NoSuchElementException;

/**
 * 固定容量环形队列的下标运算
 *
 * <p>只管理“槽位”（底层数组下标），不持有元素。逻辑偏移 0 对应队首。
 * 同容量、同操作序列的两个游标给出相同的槽位，这是并行缓冲区保持同步的基础。</p>
 */
final class RingCursor {
    private final int capacity;
    private int head;
    private int count;

    RingCursor(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    int capacity() {
        return capacity;
    }

    int size() {
        return count;
    }

    boolean isEmpty() {
        return count == 0;
    }

    boolean isFull() {
        return count == capacity;
    }

    /** 在队尾占一个槽位 */
    int pushBack() {
        if (count == capacity) {
            throw new IllegalStateException("ring buffer full: capacity=" + capacity);
        }
        int slot = wrap(head + count);
        count++;
        return slot;
    }

    /** 释放队首槽位并返回它 */
    int popFront() {
        int slot = front();
        head = wrap(head + 1);
        count--;
        return slot;
    }

    /** 释放队尾槽位并返回它 */
    int popBack() {
        int slot = back();
        count--;
        return slot;
    }

    int front() {
        if (count == 0) {
            throw new NoSuchElementException("ring buffer empty");
        }
        return head;
    }

    int back() {
        if (count == 0) {
            throw new NoSuchElementException("ring buffer empty");
        }
        return wrap(head + count - 1);
    }

    /** 逻辑偏移 → 槽位 */
    int slotAt(int offset) {
        if (offset < 0 || offset >= count) {
            throw new IndexOutOfBoundsException("offset " + offset + ", size " + count);
        }
        return wrap(head + offset);
    }

    /** 校验槽位当前是否在队列内 */
    int checkSlot(int slot) {
        if (slot < 0 || slot >= capacity || wrap(slot - head + capacity) >= count) {
            throw new IndexOutOfBoundsException("slot " + slot + " is not live");
        }
        return slot;
    }

    void clear() {
        head = 0;
        count = 0;
    }

    private int wrap(int i) {
        return i % capacity;
    }
}
