package com.ryuqq.taskindex.adapter.inmemory.avl;

import com.ryuqq.taskindex.core.model.IndexStatistics;
import com.ryuqq.taskindex.core.model.Task;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Height-balanced (AVL) binary search tree keyed by {@link Task#getPriority()}.
 *
 * <p>This class holds the structural algorithms only and is <strong>not</strong> thread-safe.
 * {@link InMemoryTaskIndex} owns the single instance and guards every call with its lock.</p>
 *
 * <p><strong>Invariants (hold after every completed mutation):</strong></p>
 * <ul>
 *   <li>BST order: left keys &lt; node key &lt; right keys (keys are unique)</li>
 *   <li>Balance: |height(left) - height(right)| &lt;= 1 at every node</li>
 *   <li>Cached heights equal the real subtree heights</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>insert / delete / find / min / max:</strong> O(log N)</li>
 *   <li><strong>range:</strong> O(log N + K) for K results</li>
 *   <li><strong>inOrder / statistics / verifyInvariants:</strong> O(N), explicit stack</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class AvlTree {

    private AvlNode root;
    private int size;

    AvlTree() {
    }

    /**
     * Adopts an existing node hierarchy as is, without rebalancing or checking it.
     *
     * <p>Tests use this to hand {@link #verifyInvariants()} shapes that no mutation can produce.</p>
     *
     * @param root root node, may be null
     * @param size node count the tree should track
     */
    AvlTree(AvlNode root, int size) {
        this.root = root;
        this.size = size;
    }

    /**
     * Inserts the task, or overwrites the payload when its priority is already present.
     *
     * <p>An overwrite keeps node identity and shape and performs no rotation.</p>
     *
     * @param task non-null task
     * @return true if a new node was added, false if an existing node was overwritten
     */
    boolean insert(Task task) {
        AvlNode existing = findNode(task.getPriority());
        if (existing != null) {
            existing.task = task;
            return false;
        }
        root = insert(root, task);
        size++;
        return true;
    }

    private static AvlNode insert(AvlNode node, Task task) {
        if (node == null) {
            return new AvlNode(task);
        }

        int key = task.getPriority();
        if (key < node.key()) {
            node.left = insert(node.left, task);
        } else {
            node.right = insert(node.right, task);
        }

        node.updateHeight();
        int balance = node.balance();

        // The side the new key went down decides single vs double rotation.
        if (balance > 1) {
            if (key < node.left.key()) {
                return rotateRight(node);
            }
            node.left = rotateLeft(node.left);
            return rotateRight(node);
        }
        if (balance < -1) {
            if (key > node.right.key()) {
                return rotateLeft(node);
            }
            node.right = rotateRight(node.right);
            return rotateLeft(node);
        }
        return node;
    }

    /**
     * Removes the node with the given priority.
     *
     * @return true if a node was removed
     */
    boolean delete(int priority) {
        if (findNode(priority) == null) {
            return false;
        }
        root = delete(root, priority);
        size--;
        return true;
    }

    private static AvlNode delete(AvlNode node, int key) {
        if (node == null) {
            return null;
        }

        if (key < node.key()) {
            node.left = delete(node.left, key);
        } else if (key > node.key()) {
            node.right = delete(node.right, key);
        } else {
            if (node.left == null || node.right == null) {
                return node.left != null ? node.left : node.right;
            }
            AvlNode successor = leftmost(node.right);
            node.task = successor.task;
            node.right = delete(node.right, successor.key());
        }

        node.updateHeight();
        return rebalance(node);
    }

    /**
     * Restores balance from the node's current children.
     * Used after deletion, where the removed key says nothing about the imbalance direction.
     */
    private static AvlNode rebalance(AvlNode node) {
        int balance = node.balance();

        if (balance > 1) {
            if (node.left.balance() < 0) {
                node.left = rotateLeft(node.left);
            }
            return rotateRight(node);
        }
        if (balance < -1) {
            if (node.right.balance() > 0) {
                node.right = rotateRight(node.right);
            }
            return rotateLeft(node);
        }
        return node;
    }

    private static AvlNode rotateRight(AvlNode y) {
        AvlNode x = y.left;
        AvlNode t2 = x.right;

        x.right = y;
        y.left = t2;

        y.updateHeight();
        x.updateHeight();
        return x;
    }

    private static AvlNode rotateLeft(AvlNode x) {
        AvlNode y = x.right;
        AvlNode t2 = y.left;

        y.left = x;
        x.right = t2;

        x.updateHeight();
        y.updateHeight();
        return y;
    }

    /**
     * Removes and returns the task with the smallest priority.
     *
     * @return the removed task, or null on an empty tree
     */
    Task pollMinimum() {
        if (root == null) {
            return null;
        }
        Task min = leftmost(root).task;
        root = delete(root, min.getPriority());
        size--;
        return min;
    }

    Task find(int priority) {
        AvlNode node = findNode(priority);
        return node != null ? node.task : null;
    }

    private AvlNode findNode(int priority) {
        AvlNode current = root;
        while (current != null) {
            if (priority == current.key()) {
                return current;
            }
            current = priority < current.key() ? current.left : current.right;
        }
        return null;
    }

    Task minimum() {
        return root != null ? leftmost(root).task : null;
    }

    Task maximum() {
        if (root == null) {
            return null;
        }
        AvlNode current = root;
        while (current.right != null) {
            current = current.right;
        }
        return current.task;
    }

    private static AvlNode leftmost(AvlNode node) {
        AvlNode current = node;
        while (current.left != null) {
            current = current.left;
        }
        return current;
    }

    /**
     * Collects tasks with {@code min <= priority <= max} in ascending order.
     * Caller guarantees {@code min <= max}.
     */
    List<Task> range(int min, int max) {
        List<Task> tasks = new ArrayList<>();
        collectRange(root, min, max, tasks);
        return tasks;
    }

    // Recursion depth is bounded by the tree height, which stays O(log N).
    private static void collectRange(AvlNode node, int min, int max, List<Task> tasks) {
        if (node == null) {
            return;
        }
        int key = node.key();
        if (min < key) {
            collectRange(node.left, min, max, tasks);
        }
        if (key >= min && key <= max) {
            tasks.add(node.task);
        }
        if (max > key) {
            collectRange(node.right, min, max, tasks);
        }
    }

    List<Task> inOrder() {
        List<Task> tasks = new ArrayList<>(size);
        Deque<AvlNode> stack = new ArrayDeque<>();
        AvlNode current = root;

        while (current != null || !stack.isEmpty()) {
            while (current != null) {
                stack.push(current);
                current = current.left;
            }
            current = stack.pop();
            tasks.add(current.task);
            current = current.right;
        }
        return tasks;
    }

    int size() {
        return size;
    }

    /**
     * Cached height of the root.
     */
    int height() {
        return AvlNode.heightOf(root);
    }

    void clear() {
        root = null;
        size = 0;
    }

    /**
     * Returns the task held by the root node.
     *
     * <p>This method is used for test assertions on rotation outcomes.</p>
     *
     * @return the root task, or null on an empty tree
     */
    Task rootTask() {
        return root != null ? root.task : null;
    }

    /**
     * Computes statistics by walking the whole tree.
     *
     * <p>Height and balance are re-derived from the actual shape rather than read from the
     * cached heights, so the result doubles as a self-check.</p>
     */
    IndexStatistics statistics() {
        if (root == null) {
            return IndexStatistics.empty();
        }
        ShapeReport report = walk();
        return IndexStatistics.of(
            report.nodeCount,
            report.height,
            report.balanced,
            minimum().getPriority(),
            maximum().getPriority()
        );
    }

    /**
     * Checks BST order, balance, cached heights and the node count.
     *
     * @throws IllegalStateException describing the first violation found
     */
    void verifyInvariants() {
        ShapeReport report = walk();
        if (report.nodeCount != size) {
            throw new IllegalStateException(
                "Node count mismatch: tracked " + size + ", found " + report.nodeCount
            );
        }
        if (!report.balanced) {
            throw new IllegalStateException("AVL balance violated at priority " + report.firstUnbalancedKey);
        }
        if (report.staleHeightKey != null) {
            throw new IllegalStateException("Cached height is stale at priority " + report.staleHeightKey);
        }

        Integer previous = null;
        for (Task task : inOrder()) {
            if (previous != null && task.getPriority() <= previous) {
                throw new IllegalStateException(
                    "BST order violated: " + task.getPriority() + " follows " + previous
                );
            }
            previous = task.getPriority();
        }
    }

    /**
     * Pre-order walk with an explicit stack; visiting it in reverse puts children before parents,
     * which lets heights be derived bottom-up without call recursion.
     */
    private ShapeReport walk() {
        ShapeReport report = new ShapeReport();
        if (root == null) {
            return report;
        }

        List<AvlNode> preOrder = new ArrayList<>(size);
        Deque<AvlNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AvlNode node = stack.pop();
            preOrder.add(node);
            if (node.right != null) {
                stack.push(node.right);
            }
            if (node.left != null) {
                stack.push(node.left);
            }
        }

        Map<AvlNode, Integer> derived = new IdentityHashMap<>(preOrder.size());
        for (int i = preOrder.size() - 1; i >= 0; i--) {
            AvlNode node = preOrder.get(i);
            int leftHeight = node.left != null ? derived.get(node.left) : 0;
            int rightHeight = node.right != null ? derived.get(node.right) : 0;
            int height = 1 + Math.max(leftHeight, rightHeight);
            derived.put(node, height);

            if (Math.abs(leftHeight - rightHeight) > 1 && report.balanced) {
                report.balanced = false;
                report.firstUnbalancedKey = node.key();
            }
            if (height != node.height && report.staleHeightKey == null) {
                report.staleHeightKey = node.key();
            }
        }

        report.nodeCount = preOrder.size();
        report.height = derived.get(root);
        return report;
    }

    private static final class ShapeReport {
        private int nodeCount;
        private int height;
        private boolean balanced = true;
        private Integer firstUnbalancedKey;
        private Integer staleHeightKey;
    }
}
