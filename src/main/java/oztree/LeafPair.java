package oztree;

import oztree.tree.TreeNode;

/**
 * Two leaves whose distances from the root differ by more than the tolerance. `shallow` is the
 * leaf nearer the root.
 */
public class LeafPair {

	private final TreeNode shallow;
	private final TreeNode deep;
	private final double shallowDepth;
	private final double deepDepth;

	public LeafPair(TreeNode shallow, double shallowDepth, TreeNode deep, double deepDepth) {
		this.shallow = shallow;
		this.shallowDepth = shallowDepth;
		this.deep = deep;
		this.deepDepth = deepDepth;
	}

	public TreeNode getShallow() {return shallow;}

	public TreeNode getDeep() {return deep;}

	public double getShallowDepth() {return shallowDepth;}

	public double getDeepDepth() {return deepDepth;}

	public double getDifference() {
		return deepDepth - shallowDepth;
	}

	@Override
	public String toString() {
		return shallow + " has age " + shallowDepth + ", but " + deep + " has age " + deepDepth;
	}
}
