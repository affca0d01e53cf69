package org.dxworks.mathframe;

import org.dxworks.mathframe.renderer.ConstructRenderer;
import org.dxworks.mathframe.renderer.FlattenRenderer;
import org.dxworks.mathframe.renderer.MathRootRenderer;
import org.dxworks.mathframe.renderer.OperatorRenderer;
import org.dxworks.mathframe.renderer.RowRenderer;
import org.dxworks.mathframe.renderer.SpaceRenderer;
import org.dxworks.mathframe.renderer.TokenRenderer;
import org.dxworks.mathframe.renderer.fenced.FencedRenderer;
import org.dxworks.mathframe.renderer.radical.NthRootRenderer;
import org.dxworks.mathframe.renderer.radical.SquareRootRenderer;
import org.dxworks.mathframe.renderer.script.SubSuperscriptRenderer;
import org.dxworks.mathframe.renderer.script.SubscriptRenderer;
import org.dxworks.mathframe.renderer.script.SuperscriptRenderer;
import org.dxworks.mathframe.renderer.stack.FractionRenderer;
import org.dxworks.mathframe.renderer.stack.UnderOverRenderer;
import org.dxworks.mathframe.renderer.stack.UnderRenderer;
import org.dxworks.mathframe.renderer.table.TableCellRenderer;
import org.dxworks.mathframe.renderer.table.TableRenderer;
import org.dxworks.mathframe.renderer.table.TableRowRenderer;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public class RendererRegistry {

    private static final ConstructRenderer FALLBACK = new FlattenRenderer();

    /** Handler for tags without a dedicated layout. */
    public static ConstructRenderer fallback() {
        return FALLBACK;
    }

    public static Map<MathTag, ConstructRenderer> buildRenderers() {
        Map<MathTag, ConstructRenderer> renderers = new EnumMap<>(MathTag.class);
        TokenRenderer tokens = new TokenRenderer();

        for (MathTag tag : MathTag.values()) {
            renderers.put(tag, createRenderer(tag, tokens));
        }

        return Collections.unmodifiableMap(renderers);
    }

    private static ConstructRenderer createRenderer(MathTag tag, TokenRenderer tokens) {
        return switch (tag) {
            case MATH -> new MathRootRenderer();
            case MROW -> new RowRenderer();
            case MI, MN, MTEXT -> tokens;
            case MO -> new OperatorRenderer();
            case MSPACE -> new SpaceRenderer();
            case MFRAC -> new FractionRenderer();
            case MSUB -> new SubscriptRenderer();
            case MSUP -> new SuperscriptRenderer();
            case MSUBSUP -> new SubSuperscriptRenderer();
            case MUNDER -> new UnderRenderer();
            case MUNDEROVER -> new UnderOverRenderer();
            case MSQRT -> new SquareRootRenderer();
            case MROOT -> new NthRootRenderer();
            case MTABLE -> new TableRenderer();
            case MTR -> new TableRowRenderer();
            case MTD -> new TableCellRenderer();
            case MFENCED -> new FencedRenderer();
            case UNKNOWN -> FALLBACK;
        };
    }
}
