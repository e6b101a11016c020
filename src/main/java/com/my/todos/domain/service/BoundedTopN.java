package com.my.todos.domain.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * 왜: 필터된 전체 집합을 정렬하지 않고 한 번의 순회로 상위 N개만 남기기 위함.
 * 내부는 크기 N 이하의 최대 힙이며 루트가 현재 가장 나쁜 후보다. 전체 비용은 O(n log N).
 */
final class BoundedTopN<T> {

    private final int capacity;
    private final Comparator<? super T> order;
    private final PriorityQueue<T> heap;

    BoundedTopN(int capacity, Comparator<? super T> order) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity는 1 이상이어야 합니다: " + capacity);
        }
        this.capacity = capacity;
        this.order = order;
        this.heap = new PriorityQueue<>(capacity, order.reversed());
    }

    /**
     * 자리가 남아 있으면 넣고, 가득 찼으면 현재 최악보다 엄격히 앞설 때만 교체한다.
     */
    void offer(T candidate) {
        if (heap.size() < capacity) {
            heap.add(candidate);
            return;
        }
        T worst = heap.peek();
        if (order.compare(candidate, worst) < 0) {
            heap.poll();
            heap.add(candidate);
        }
    }

    int size() {
        return heap.size();
    }

    List<T> toSortedList() {
        List<T> result = new ArrayList<>(heap);
        result.sort(order);
        return result;
    }
}
