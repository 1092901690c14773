package com.lineweave.core.buffer;

/**
 * 固定容量、可随机访问的环形双端队列
 *
 * <p>所有操作 O(1)。队满时追加视为内部不变量被破坏，抛出 {@link IllegalStateException}；
 * 空队列上取元素抛出 {@link java.util.NoSuchElementException}。</p>
 *
 * @param <E> 元素类型
 */
public final class RingBuffer<E> {
    private final Object[] elements;
    private final RingCursor cursor;

    public RingBuffer(int capacity) {
        this.cursor = new RingCursor(capacity);
        this.elements = new Object[capacity];
    }

    /**
     * 追加到队尾
     *
     * @return 新元素所在槽位，在元素出队前保持有效
     */
    public int append(E element) {
        int slot = cursor.pushBack();
        elements[slot] = element;
        return slot;
    }

    public E removeFirst() {
        int slot = cursor.popFront();
        E e = elementAt(slot);
        elements[slot] = null;
        return e;
    }

    public E removeLast() {
        int slot = cursor.popBack();
        E e = elementAt(slot);
        elements[slot] = null;
        return e;
    }

    public E peekFirst() {
        return elementAt(cursor.front());
    }

    public E peekLast() {
        return elementAt(cursor.back());
    }

    /** 按距队首的逻辑偏移读取 */
    public E get(int offset) {
        return elementAt(cursor.slotAt(offset));
    }

    public void set(int offset, E element) {
        elements[cursor.slotAt(offset)] = element;
    }

    public E getSlot(int slot) {
        return elementAt(cursor.checkSlot(slot));
    }

    public void setSlot(int slot, E element) {
        elements[cursor.checkSlot(slot)] = element;
    }

    /** 队首元素的槽位 */
    public int firstSlot() {
        return cursor.front();
    }

    /**
     * 清空队列，不重新分配存储。旧引用留在数组里，直到被覆盖。
     */
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

    @SuppressWarnings("unchecked")
    private E elementAt(int slot) {
        return (E) elements[slot];
    }
}
