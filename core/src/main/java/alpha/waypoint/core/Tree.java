package alpha.waypoint.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import static alpha.waypoint.core.Segments.ASTERISK_STR;
import static alpha.waypoint.core.Segments.COLON_CH;
import static java.util.Objects.requireNonNull;

/**
 * A tree where a node's key is split into segments and distributed across the
 * branch. No node in the tree store its key; the node's position defines it.
 * All descendants of a node share a common key prefix and the root is the only
 * node associated with an empty key.<p>
 * 
 * A node may have three types of children at the same time:
 * 
 * <ul>
 *   <li>Any number of literal children, keyed by the exact segment.</li>
 *   <li>At most one parameter child, which carries a parameter name.</li>
 *   <li>At most one wildcard child.</li>
 * </ul>
 * 
 * Which type of child to prefer is decided by the reader of the tree, not by
 * the tree itself.<p>
 * 
 * The tree only grows. It is not thread-safe; writes must happen-before all
 * reads, which may then run concurrently.
 * 
 * @param <V> type of the node's associated value
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class Tree<V>
{
    private final Node<V> root = new Node<>();
    
    /**
     * Returns the root node.
     * 
     * @return the root node (never {@code null})
     */
    Node<V> root() {
        return root;
    }
    
    /**
     * Flatten the tree and dump all node values; designed for tests only.<p>
     * 
     * Parameter nodes are keyed ":name" and the wildcard node "*". Nodes
     * without a value are not included.
     * 
     * @param delimiter used to join all key segments
     * 
     * @return a map of the tree
     */
    Map<String, V> toMap(String delimiter) {
        SortedMap<String, V> m = new TreeMap<>();
        root.collect("", delimiter, m);
        return Collections.unmodifiableMap(m);
    }
    
    /**
     * A node of the tree.
     * 
     * @param <V> type of the node's associated value
     */
    static final class Node<V> {
        private final Map<String, Node<V>> literals = new HashMap<>();
        private Node<V> param, wildcard;
        private String paramName;
        private V val;
        
        /**
         * Returns this node's value, or {@code null} if not present.
         * 
         * @return this node's value, or {@code null} if not present
         */
        V get() {
            return val;
        }
        
        /**
         * Sets this node's value.
         * 
         * @param v value
         * 
         * @return the previous value (may be {@code null})
         * 
         * @throws NullPointerException if {@code v} is {@code null}
         */
        V set(V v) {
            V old = val;
            val = requireNonNull(v);
            return old;
        }
        
        /**
         * Traverse to a literal child.
         * 
         * @param segment exact key
         * 
         * @return the child node (or {@code null} if it does not exist)
         */
        Node<V> literal(String segment) {
            return literals.get(segment);
        }
        
        /**
         * Traverse to a literal child, creating it if it does not exist.
         * 
         * @param segment exact key
         * 
         * @return the child node (never {@code null})
         */
        Node<V> literalOrCreate(String segment) {
            return literals.computeIfAbsent(segment, k -> new Node<>());
        }
        
        /**
         * Traverse to the parameter child.
         * 
         * @return the child node (or {@code null} if it does not exist)
         */
        Node<V> param() {
            return param;
        }
        
        /**
         * Returns the name of the parameter child.
         * 
         * @return the name (or {@code null} if the child does not exist)
         */
        String paramName() {
            return paramName;
        }
        
        /**
         * Traverse to the parameter child, creating it if it does not exist.<p>
         * 
         * The child's name is set to the given name.
         * 
         * @param name of parameter
         * 
         * @return the child node (never {@code null})
         */
        Node<V> paramOrCreate(String name) {
            requireNonNull(name);
            if (param == null) {
                param = new Node<>();
            }
            paramName = name;
            return param;
        }
        
        /**
         * Traverse to the wildcard child.
         * 
         * @return the child node (or {@code null} if it does not exist)
         */
        Node<V> wildcard() {
            return wildcard;
        }
        
        /**
         * Traverse to the wildcard child, creating it if it does not exist.
         * 
         * @return the child node (never {@code null})
         */
        Node<V> wildcardOrCreate() {
            if (wildcard == null) {
                wildcard = new Node<>();
            }
            return wildcard;
        }
        
        private void collect(String path, String delimiter, Map<String, V> sink) {
            if (val != null && sink.putIfAbsent(path.isEmpty() ? delimiter : path, val) != null) {
                throw new AssertionError("Duplicated path/key: " + path);
            }
            literals.forEach((k, n) -> n.collect(path + delimiter + k, delimiter, sink));
            if (param != null) {
                param.collect(path + delimiter + COLON_CH + paramName, delimiter, sink);
            }
            if (wildcard != null) {
                wildcard.collect(path + delimiter + ASTERISK_STR, delimiter, sink);
            }
        }
    }
}
