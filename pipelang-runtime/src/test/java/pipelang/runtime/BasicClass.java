package pipelang.runtime;

/**
 * 测试用宿主类：公共字段、getter 与普通方法
 */
public class BasicClass {

    public long value;

    public BasicClass(long value) {
        this.value = value;
    }

    public void increment() {
        value++;
    }

    public long getValueProperty() {
        return value;
    }

    public long getValueMethod() {
        return value;
    }

    public long getValuePlusArg(long arg) {
        return value + arg;
    }
}
