package ddx.tree;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.MoreObjects;

/** Build-time limits for a tree. */
public final class TreeParams {
  public static final int    DEFAULT_MAX_DEPTH        = 10;
  public static final int    DEFAULT_MIN_SAMPLES_LEAF = 1;
  public static final double DEFAULT_MIN_GAIN_RATIO   = 0.0;

  public static final TreeParams DEFAULT =
    new TreeParams(DEFAULT_MAX_DEPTH, DEFAULT_MIN_SAMPLES_LEAF, DEFAULT_MIN_GAIN_RATIO);

  final int    _maxDepth;       // Tree-depth cutoff, a root leaf has depth 0
  final int    _minSamplesLeaf; // Smallest record set that may still be split
  final double _minGainRatio;   // Best gain ratio below which a split isn't worth it

  public TreeParams(int maxDepth, int minSamplesLeaf, double minGainRatio) {
    checkArgument(maxDepth >= 0, "max_depth must be non-negative: %s", maxDepth);
    checkArgument(minSamplesLeaf >= 0, "min_samples_leaf must be non-negative: %s", minSamplesLeaf);
    checkArgument(!Double.isNaN(minGainRatio) && minGainRatio >= 0,
        "min_gain_ratio must be a non-negative number: %s", minGainRatio);
    _maxDepth = maxDepth;
    _minSamplesLeaf = minSamplesLeaf;
    _minGainRatio = minGainRatio;
  }

  public int    maxDepth()       { return _maxDepth;       }
  public int    minSamplesLeaf() { return _minSamplesLeaf; }
  public double minGainRatio()   { return _minGainRatio;   }

  @Override public String toString() {
    return MoreObjects.toStringHelper(this)
      .add("max_depth", _maxDepth)
      .add("min_samples_leaf", _minSamplesLeaf)
      .add("min_gain_ratio", _minGainRatio)
      .toString();
  }
}
