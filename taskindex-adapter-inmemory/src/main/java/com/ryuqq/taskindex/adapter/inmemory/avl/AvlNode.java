package com.ryuqq.taskindex.adapter.inmemory.avl;

import com.ryuqq.taskindex.core.model.Task;

/**
 * AVL 트리 노드.
 *
 * <p>하나의 Task와 최대 두 개의 자식, 캐시된 높이(빈 서브트리 0, leaf 1)를 가집니다.
 * 트리 외부로 노출되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class AvlNode {

    Task task;
    AvlNode left;
    AvlNode right;
    int height;

    AvlNode(Task task) {
        this.task = task;
        this.height = 1;
    }

    int key() {
        return task.getPriority();
    }

    static int heightOf(AvlNode node) {
        return node == null ? 0 : node.height;
    }

    /**
     * height(left) - height(right).
     */
    int balance() {
        return heightOf(left) - heightOf(right);
    }

    void updateHeight() {
        height = 1 + Math.max(heightOf(left), heightOf(right));
    }
}
