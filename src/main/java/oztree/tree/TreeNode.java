package oztree.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Stack;

public class TreeNode {

	/*
	 * common associations
	 */
	private double BL; // branch length, NaN when unknown
	private String name;
	private String taxonId;
	private TreeNode parent;
	private ArrayList<TreeNode> children;
	private ArrayList<Directive> directives;

	/*
	 * constructors
	 */
	public TreeNode() {
		this.BL = Double.NaN;
		this.name = "";
		this.taxonId = null;
		this.parent = null;
		this.children = new ArrayList<TreeNode>();
		this.directives = new ArrayList<Directive>();
	}

	public TreeNode(String name) {
		this();
		setName(name);
	}

	public TreeNode(String name, double BL) {
		this();
		setName(name);
		this.BL = BL;
	}

	/* ---------------------------- begin node iterators --------------------------------*/

	/**
	 * @return this node and all of its descendants in the requested order. Children are visited
	 *		in their stored order in both cases.
	 */
	public List<TreeNode> getDescendants(NodeOrder order) {
		LinkedList<TreeNode> nodes = new LinkedList<TreeNode>();
		Stack<TreeNode> stack = new Stack<TreeNode>();
		stack.push(this);
		if (order == NodeOrder.PREORDER) {
			while (!stack.isEmpty()) {
				TreeNode cur = stack.pop();
				nodes.add(cur);
				for (int i = cur.getChildCount() - 1; i >= 0; i--) {
					stack.push(cur.getChild(i));
				}
			}
		} else {
			// reversed (node, right child ... left child) preorder is a postorder read backwards
			while (!stack.isEmpty()) {
				TreeNode cur = stack.pop();
				nodes.addFirst(cur);
				for (int i = 0; i < cur.getChildCount(); i++) {
					stack.push(cur.getChild(i));
				}
			}
		}
		return nodes;
	}

	/**
	 * @return the leaves of the subtree rooted at `this`, left to right
	 */
	public List<TreeNode> getDescendantLeaves() {
		ArrayList<TreeNode> leaves = new ArrayList<TreeNode>();
		for (TreeNode descendant : getDescendants(NodeOrder.PREORDER)) {
			if (descendant.isExternal()) {
				leaves.add(descendant);
			}
		}
		return leaves;
	}

	/* ---------------------------- end node iterators --------------------------------*/

	public List<TreeNode> getChildren() {return Collections.unmodifiableList(this.children);}

	public boolean isExternal() {return (this.children.size() < 1);}

	public boolean isInternal() {return (this.children.size() > 0);}

	public boolean isTheRoot() {return (this.parent == null);}

	public TreeNode getParent() {return this.parent;}

	public int getChildCount() {return this.children.size();}

	/**
	 * @return the c-th child or throw IndexOutOfBoundsException.
	 */
	public TreeNode getChild(int c) throws IndexOutOfBoundsException {
		return this.children.get(c);
	}

	public int indexOfChild(TreeNode c) {
		for (int i = 0; i < this.children.size(); i++) {
			if (this.children.get(i) == c) {
				return i;
			}
		}
		return -1;
	}

	public void addChild(TreeNode c) {
		if (c.parent != null) {
			throw new IllegalArgumentException("node '" + c.getName() + "' already has a parent");
		}
		this.children.add(c);
		c.parent = this;
	}

	public boolean removeChild(TreeNode c) {
		int i = indexOfChild(c);
		if (i < 0) {
			return false;
		}
		this.children.remove(i);
		c.parent = null;
		return true;
	}

	/**
	 * Puts `replacement` at the position currently held by `old`, keeping sibling order.
	 */
	public void replaceChild(TreeNode old, TreeNode replacement) {
		int i = indexOfChild(old);
		if (i < 0) {
			throw new IllegalArgumentException("node '" + old.getName() + "' is not a child of '" + this.name + "'");
		}
		if (replacement.parent != null) {
			throw new IllegalArgumentException("node '" + replacement.getName() + "' already has a parent");
		}
		this.children.set(i, replacement);
		old.parent = null;
		replacement.parent = this;
	}

	public double getBL() {return this.BL;}

	public void setBL(double b) {this.BL = b;}

	public boolean hasBranchLength() {return !Double.isNaN(this.BL);}

	/**
	 * @return the branch length, or 0 when it is unknown
	 */
	public double getBLOrZero() {return hasBranchLength() ? this.BL : 0.0;}

	public void setName(String s) {this.name = (s == null) ? "" : s;}

	public String getName() {return this.name;}

	public boolean hasName() {return this.name.length() > 0;}

	public String getTaxonId() {return this.taxonId;}

	public void setTaxonId(String id) {this.taxonId = id;}

	/**
	 * @return the identifier used for lookups: the taxon id when present, otherwise the
	 *		label, or null for an anonymous node
	 */
	public String getKey() {
		if (this.taxonId != null) {
			return this.taxonId;
		}
		return hasName() ? this.name : null;
	}

	public List<Directive> getDirectives() {return Collections.unmodifiableList(this.directives);}

	public void addDirective(Directive d) {this.directives.add(d);}

	public void clearDirectives() {this.directives.clear();}

	/**
	 * @return the first directive of the given kind, or null
	 */
	public Directive getDirective(Directive.Kind kind) {
		for (Directive d : this.directives) {
			if (d.getKind() == kind) {
				return d;
			}
		}
		return null;
	}

	public boolean isGraftPoint() {
		return getDirective(Directive.Kind.GRAFT) != null;
	}

	/**
	 * @return a copy of this node's label, id, branch length and directives, with no parent or children
	 */
	public TreeNode copyShallow() {
		TreeNode copy = new TreeNode(this.name, this.BL);
		copy.taxonId = this.taxonId;
		copy.directives.addAll(this.directives);
		return copy;
	}

	/**
	 * @return a deep copy of the subtree rooted at `this`; built with an explicit stack
	 */
	public TreeNode copySubtree() {
		TreeNode copyRoot = copyShallow();
		Stack<TreeNode[]> stack = new Stack<TreeNode[]>();
		stack.push(new TreeNode[] {this, copyRoot});
		while (!stack.isEmpty()) {
			TreeNode[] pair = stack.pop();
			for (TreeNode child : pair[0].children) {
				TreeNode childCopy = child.copyShallow();
				pair[1].addChild(childCopy);
				stack.push(new TreeNode[] {child, childCopy});
			}
		}
		return copyRoot;
	}

	/**
	 * @return Returns the number of tips in the subtree rooted at `this`
	 */
	public int getTipCount() {
		int count = 0;
		Stack<TreeNode> nodes = new Stack<TreeNode>();
		nodes.push(this);
		while (nodes.isEmpty() == false) {
			TreeNode jt = nodes.pop();
			for (int i = 0; i < jt.getChildCount(); i++) {
				nodes.push(jt.getChild(i));
			}
			if (jt.isExternal()) {
				count += 1;
			}
		}
		return count;
	}

	/**
	 * @return the summed branch lengths from the root of the tree down to `this`, counting
	 *		unknown lengths as 0 and excluding the root's own edge
	 */
	public double getDistanceFromRoot() {
		double d = 0.0;
		TreeNode cur = this;
		while (cur.parent != null) {
			d += cur.getBLOrZero();
			cur = cur.parent;
		}
		return d;
	}

	@Override
	public String toString() {
		return NewickWriter.formatLabel(this);
	}
}
