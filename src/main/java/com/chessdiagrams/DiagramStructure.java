package com.chessdiagrams;

import com.google.gson.annotations.SerializedName;

/**
 * Order in which a book lays out the header, board and solution of a diagram.
 * Each layout knows which blocks can anchor a diagram and where to look for
 * the remaining roles. Every window is relative to the anchor and at most the
 * context's search distance wide on each side.
 */
public enum DiagramStructure {

    @SerializedName("header_image_solution")
    HEADER_IMAGE_SOLUTION {
        @Override
        public boolean isAnchor(Block block, AssemblyContext context) {
            return context.isHeader(block);
        }

        @Override
        public DiagramCandidate locateRoles(Block anchor, AssemblyContext context) {
            int i = anchor.getGlobalIndex();
            int d = context.getMaxDistance();
            Block image = context.nearest(Role.IMAGE, anchor, i + 1, upTo(i, d));
            Block solution = image == null ? null
                    : context.nearest(Role.SOLUTION, anchor, image.getGlobalIndex() + 1, upTo(i, d));
            return new DiagramCandidate(anchor, anchor, image, solution);
        }
    },

    @SerializedName("image_header_solution")
    IMAGE_HEADER_SOLUTION {
        @Override
        public boolean isAnchor(Block block, AssemblyContext context) {
            return context.isChessboard(block);
        }

        @Override
        public DiagramCandidate locateRoles(Block anchor, AssemblyContext context) {
            int i = anchor.getGlobalIndex();
            int d = context.getMaxDistance();
            Block header = context.nearest(Role.HEADER, anchor, downTo(i, d), i - 1);
            Block solution = context.nearest(Role.SOLUTION, anchor, i + 1, upTo(i, d));
            return new DiagramCandidate(anchor, header, anchor, solution);
        }
    },

    @SerializedName("header_solution_image")
    HEADER_SOLUTION_IMAGE {
        @Override
        public boolean isAnchor(Block block, AssemblyContext context) {
            return context.isHeader(block);
        }

        @Override
        public DiagramCandidate locateRoles(Block anchor, AssemblyContext context) {
            int i = anchor.getGlobalIndex();
            int d = context.getMaxDistance();
            Block solution = context.nearest(Role.SOLUTION, anchor, i + 1, upTo(i, d));
            int imageFrom = solution == null ? i + 1 : solution.getGlobalIndex() + 1;
            Block image = context.nearest(Role.IMAGE, anchor, imageFrom, upTo(i, d));
            return new DiagramCandidate(anchor, anchor, image, solution);
        }
    },

    @SerializedName("flexible")
    FLEXIBLE {
        @Override
        public boolean isAnchor(Block block, AssemblyContext context) {
            return context.roleOf(block) != null;
        }

        /**
         * Roles are resolved header, image, solution. Each block found narrows the
         * window of the next search so that every pair stays within the distance.
         */
        @Override
        public DiagramCandidate locateRoles(Block anchor, AssemblyContext context) {
            int d = context.getMaxDistance();
            Role anchorRole = context.roleOf(anchor);
            int a = anchor.getGlobalIndex();
            int[] window = {downTo(a, d), upTo(a, d)};

            Block header = anchorRole == Role.HEADER ? anchor : context.nearest(Role.HEADER, anchor, window[0], window[1]);
            narrow(window, header, d);
            Block image = anchorRole == Role.IMAGE ? anchor : context.nearest(Role.IMAGE, anchor, window[0], window[1]);
            narrow(window, image, d);
            Block solution = anchorRole == Role.SOLUTION ? anchor
                    : context.nearest(Role.SOLUTION, anchor, window[0], window[1]);
            return new DiagramCandidate(anchor, header, image, solution);
        }

        // intersects the window with [b-d, b+d]
        private void narrow(int[] window, Block block, int d) {
            if (block != null) {
                window[0] = Math.max(window[0], downTo(block.getGlobalIndex(), d));
                window[1] = Math.min(window[1], upTo(block.getGlobalIndex(), d));
            }
        }
    };

    public abstract boolean isAnchor(Block block, AssemblyContext context);

    public abstract DiagramCandidate locateRoles(Block anchor, AssemblyContext context);

    // window bounds saturate instead of overflowing for very large distances
    static int upTo(int index, int distance) {
        return (int) Math.min((long) index + distance, Integer.MAX_VALUE);
    }

    static int downTo(int index, int distance) {
        return (int) Math.max((long) index - distance, Integer.MIN_VALUE);
    }
}
