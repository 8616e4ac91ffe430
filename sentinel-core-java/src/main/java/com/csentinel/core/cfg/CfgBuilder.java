package com.csentinel.core.cfg;

import com.csentinel.core.ast.*;
import com.csentinel.core.diagnostics.Diagnostics;
import com.csentinel.core.diagnostics.Phase;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds one control-flow graph per function body in a single forward pass.
 *
 * Plain statements are appended to the block under the cursor. Each control
 * construct opens its own blocks and moves the cursor to the block where
 * execution continues afterwards. After return, break or continue the cursor
 * moves to a fresh block labelled "unreachable": later statements are still
 * recorded there but no edge leads in.
 *
 * Cursor and jump-target stack are reset by every {@link #build(FunctionDef)}.
 */
public class CfgBuilder {

    private final Diagnostics diagnostics;
    private final InstructionFormatter formatter = new InstructionFormatter();

    private ControlFlowGraph cfg;
    private BasicBlock current;
    private boolean detached;
    private Deque<JumpTargets> jumpTargets;

    public CfgBuilder(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /** break/continue destinations of one enclosing loop or switch. */
    private record JumpTargets(BasicBlock breakTarget, BasicBlock continueTarget, SwitchHead switchHead) {}

    private static final class SwitchHead {
        final BasicBlock head;
        boolean sawDefault;

        SwitchHead(BasicBlock head) {
            this.head = head;
        }
    }

    /**
     * One graph per defined function, keyed by name in source order. Prototypes
     * are skipped. A function whose build fails is logged and left out.
     */
    public Map<String, ControlFlowGraph> buildAll(Program program) {
        Map<String, ControlFlowGraph> graphs = new LinkedHashMap<>();
        if (program == null) return graphs;
        for (FunctionDef function : program.functions()) {
            if (function.isPrototype() || function.name() == null) continue;
            try {
                if (graphs.containsKey(function.name())) {
                    diagnostics.warn(Phase.CFG, "Function '" + function.name()
                            + "' defined more than once, keeping the last definition");
                }
                graphs.put(function.name(), new CfgBuilder(diagnostics).build(function));
            } catch (RuntimeException e) {
                diagnostics.error(Phase.CFG, "CFG construction failed for '" + function.name() + "': " + e);
            }
        }
        diagnostics.info(Phase.CFG, "built " + graphs.size() + " control-flow graphs");
        return graphs;
    }

    public ControlFlowGraph build(FunctionDef function) {
        cfg = new ControlFlowGraph(function.name());
        jumpTargets = new ArrayDeque<>();
        BasicBlock entry = cfg.newBlock("entry_" + function.name());
        cfg.setEntry(entry);
        moveTo(entry);

        visit(function.body());
        return cfg;
    }

    private void visit(Node node) {
        if (node == null) return;
        switch (node.kind()) {
            case COMPOUND      -> ((Compound) node).items().forEach(this::visit);
            case IF_STMT       -> visitIf((IfStmt) node);
            case WHILE_STMT    -> visitWhile((WhileStmt) node);
            case DO_WHILE_STMT -> visitDoWhile((DoWhileStmt) node);
            case FOR_STMT      -> visitFor((ForStmt) node);
            case SWITCH_STMT   -> visitSwitch((SwitchStmt) node);
            case CASE_STMT     -> visitCase((CaseStmt) node);
            case DEFAULT_STMT  -> visitDefault((DefaultStmt) node);
            case RETURN        -> visitReturn((Return) node);
            case BREAK         -> visitBreak((Break) node);
            case CONTINUE      -> visitContinue((Continue) node);
            default            -> append(formatter.format(node));
        }
    }

    private void visitIf(IfStmt node) {
        current.addInstruction("IF (" + formatter.format(node.cond()) + ")");
        BasicBlock pred = current;

        BasicBlock thenBlock = cfg.newBlock("then");
        BasicBlock merge = cfg.newBlock("if_merge");

        pred.addSuccessor(thenBlock);
        moveTo(thenBlock);
        visit(node.thenStmt());
        linkTo(merge);

        if (node.elseStmt() != null) {
            BasicBlock elseBlock = cfg.newBlock("else");
            pred.addSuccessor(elseBlock);
            moveTo(elseBlock);
            visit(node.elseStmt());
            linkTo(merge);
        } else {
            pred.addSuccessor(merge);
        }
        moveTo(merge);
    }

    private void visitWhile(WhileStmt node) {
        BasicBlock header = cfg.newBlock("while_cond");
        linkTo(header);
        BasicBlock body = cfg.newBlock("while_body");
        BasicBlock exit = cfg.newBlock("while_exit");

        header.addInstruction("WHILE (" + formatter.format(node.cond()) + ")");
        header.addSuccessor(body);
        header.addSuccessor(exit);

        jumpTargets.push(new JumpTargets(exit, header, null));
        moveTo(body);
        visit(node.body());
        linkTo(header);
        jumpTargets.pop();

        moveTo(exit);
    }

    private void visitDoWhile(DoWhileStmt node) {
        BasicBlock body = cfg.newBlock("do_body");
        BasicBlock cond = cfg.newBlock("do_cond");
        BasicBlock exit = cfg.newBlock("do_exit");
        linkTo(body);

        jumpTargets.push(new JumpTargets(exit, cond, null));
        moveTo(body);
        visit(node.body());
        linkTo(cond);
        jumpTargets.pop();

        cond.addInstruction("DO_WHILE (" + formatter.format(node.cond()) + ")");
        cond.addSuccessor(body);
        cond.addSuccessor(exit);
        moveTo(exit);
    }

    private void visitFor(ForStmt node) {
        if (node.init() != null) {
            current.addInstruction("FOR_INIT (" + formatter.format(node.init()) + ")");
        }
        BasicBlock header = cfg.newBlock("for_cond");
        linkTo(header);
        BasicBlock body = cfg.newBlock("for_body");
        BasicBlock post = cfg.newBlock("for_post");
        BasicBlock exit = cfg.newBlock("for_exit");

        header.addInstruction("FOR (" + formatter.format(node.cond()) + ")");
        header.addSuccessor(body);
        // a missing condition never fails, so only break leaves for(;;)
        if (node.cond() != null) {
            header.addSuccessor(exit);
        }

        jumpTargets.push(new JumpTargets(exit, post, null));
        moveTo(body);
        visit(node.body());
        linkTo(post);
        jumpTargets.pop();

        moveTo(post);
        if (node.post() != null) {
            post.addInstruction("FOR_POST (" + formatter.format(node.post()) + ")");
        }
        post.addSuccessor(header);

        moveTo(exit);
    }

    private void visitSwitch(SwitchStmt node) {
        current.addInstruction(formatter.format(node));
        SwitchHead switchHead = new SwitchHead(current);
        BasicBlock exit = cfg.newBlock("switch_exit");

        jumpTargets.push(new JumpTargets(exit, null, switchHead));
        // statements before the first case label never run
        detach();
        visit(node.body());
        linkTo(exit);
        jumpTargets.pop();

        if (!switchHead.sawDefault) {
            switchHead.head.addSuccessor(exit);
        }
        moveTo(exit);
    }

    private void visitCase(CaseStmt node) {
        openLabel("case " + formatter.format(node.value()), formatter.format(node), false);
        visit(node.statement());
    }

    private void visitDefault(DefaultStmt node) {
        openLabel("default", formatter.format(node), true);
        visit(node.statement());
    }

    private void openLabel(String label, String instruction, boolean isDefault) {
        SwitchHead switchHead = innermostSwitch();
        if (switchHead == null) {
            diagnostics.warn(Phase.CFG, "'" + instruction + "' outside switch in " + cfg.getFunctionName());
            append(instruction);
            return;
        }
        BasicBlock block = cfg.newBlock(label);
        switchHead.head.addSuccessor(block);
        if (isDefault) switchHead.sawDefault = true;
        linkTo(block);
        moveTo(block);
        block.addInstruction(instruction);
    }

    private void visitReturn(Return node) {
        current.addInstruction(formatter.format(node));
        detach();
    }

    private void visitBreak(Break node) {
        current.addInstruction("break");
        JumpTargets targets = jumpTargets.peek();
        if (targets == null) {
            diagnostics.warn(Phase.CFG, "break outside loop or switch in " + cfg.getFunctionName()
                    + " at line " + node.line());
            return;
        }
        linkTo(targets.breakTarget());
        detach();
    }

    private void visitContinue(Continue node) {
        current.addInstruction("continue");
        BasicBlock target = innermostContinueTarget();
        if (target == null) {
            diagnostics.warn(Phase.CFG, "continue outside loop in " + cfg.getFunctionName()
                    + " at line " + node.line());
            return;
        }
        linkTo(target);
        detach();
    }

    private BasicBlock innermostContinueTarget() {
        for (Iterator<JumpTargets> it = jumpTargets.iterator(); it.hasNext(); ) {
            JumpTargets t = it.next();
            if (t.continueTarget() != null) return t.continueTarget();
        }
        return null;
    }

    private SwitchHead innermostSwitch() {
        for (JumpTargets t : jumpTargets) {
            if (t.switchHead() != null) return t.switchHead();
            if (t.continueTarget() != null) return null;
        }
        return null;
    }

    private void append(String instruction) {
        if (instruction != null && !instruction.isEmpty()) {
            current.addInstruction(instruction);
        }
    }

    private void moveTo(BasicBlock block) {
        current = block;
        detached = false;
    }

    /** Falls through from the cursor into {@code target}, unless the cursor sits in dead code. */
    private void linkTo(BasicBlock target) {
        if (!detached) {
            current.addSuccessor(target);
        }
    }

    private void detach() {
        current = cfg.newBlock("unreachable");
        detached = true;
    }
}
