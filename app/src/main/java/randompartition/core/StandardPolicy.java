package randompartition.core;

/** The built-in restriction policies that need no parameters. */
public enum StandardPolicy implements RestrictionPolicy {
  UNRESTRICTED {
    @Override
    public long partSize(long index) {
      return index;
    }
  },
  EVEN {
    @Override
    public long partSize(long index) {
      return 2 * index;
    }
  },
  ODD {
    @Override
    public long partSize(long index) {
      return 2 * index - 1;
    }
  },
  TRIANGULAR {
    @Override
    public long partSize(long index) {
      return index * (index + 1) / 2;
    }
  };
}
