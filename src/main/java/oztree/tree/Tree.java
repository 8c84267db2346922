package oztree.tree;

import java.util.List;

/**
 * A rooted tree, plus the free-text comment block that preceded it in its source file.
 * The node lists are computed on demand, so a tree stays consistent while its nodes are edited.
 */
public class Tree {

	private TreeNode root;
	private String comment;

	public Tree(TreeNode root) {
		this.root = root;
		this.comment = null;
	}

	public Tree(TreeNode root, String comment) {
		this.root = root;
		this.comment = comment;
	}

	public TreeNode getRoot() {return root;}

	public void setRoot(TreeNode root) {this.root = root;}

	/**
	 * @return the text of the leading [...] comment block (without brackets), or null
	 */
	public String getComment() {return comment;}

	public void setComment(String comment) {this.comment = comment;}

	public List<TreeNode> nodes(NodeOrder order) {
		return root.getDescendants(order);
	}

	public List<TreeNode> externalNodes() {
		return root.getDescendantLeaves();
	}

	public int getNodeCount() {
		return root.getDescendants(NodeOrder.PREORDER).size();
	}

	public int getExternalNodeCount() {
		return root.getTipCount();
	}

	/**
	 * @return a deep copy of this tree, sharing nothing with it
	 */
	public Tree copy() {
		return new Tree(root.copySubtree(), comment);
	}

	@Override
	public String toString() {
		return new NewickWriter().write(this);
	}
}
