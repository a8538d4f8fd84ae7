package org.cfglab.cfg;

import org.cfglab.ast.Return;
import org.cfglab.ast.Statement;

/**
 * 构建控制流图时在语句之间传递的"前驱"
 * <p>
 * 不可变值：每访问一条语句就返回一个新的 Flow，而不是在访问者上保存"是否已遇到 return"之类的状态。
 *
 * @param last  最近一条加入图中的语句，尚无语句时为 null
 * @param state 当前所处的控制流状态
 */
public record Flow(Statement last, State state) {

    public enum State {
        /** 正常可达的顺序流，下一条语句从 last 连边 */
        LIVE,
        /** 刚经过一条 return，下一条兄弟语句不连边，并开始一条死代码链 */
        TERMINATED,
        /** 同一语句块内 return 之后的死代码链，链内依次连边 */
        DEAD,
        /** 终止状态已跨越语句块边界返回，此后同层的每条语句都是孤立顶点 */
        ISOLATED
    }

    private static final Flow ENTRY = new Flow(null, State.LIVE);

    /**
     * @return 根调用使用的初始前驱（没有前驱语句）
     */
    public static Flow entry() {
        return ENTRY;
    }

    /**
     * @return 下一条语句是否应当从 last 连一条边
     */
    public boolean connects() {
        return last != null && (state == State.LIVE || state == State.DEAD);
    }

    /**
     * 经过 statement 之后的新前驱
     */
    public Flow after(Statement statement) {
        if (state == State.ISOLATED) {
            return new Flow(statement, State.ISOLATED);
        }
        if (statement instanceof Return) {
            return new Flow(statement, State.TERMINATED);
        }
        return new Flow(statement, state == State.LIVE ? State.LIVE : State.DEAD);
    }

    /**
     * 离开一个嵌套语句块时调用。块内把终止状态带了出来，则对外层后续语句变为孤立；
     * 块没有改变前驱（例如空块）时原样透传。
     *
     * @param entered 进入该语句块时的前驱
     */
    public Flow leaveBlock(Flow entered) {
        boolean terminatedInside = state == State.TERMINATED || state == State.DEAD;
        if (terminatedInside && !equals(entered)) {
            return new Flow(last, State.ISOLATED);
        }
        return this;
    }
}
