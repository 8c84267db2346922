package oztree.tree;

/**
 * Traversal orders supported by the node iterators. Both are produced with an explicit
 * stack, so arbitrarily deep trees can be walked.
 */
public enum NodeOrder {
	PREORDER,
	POSTORDER;
}
