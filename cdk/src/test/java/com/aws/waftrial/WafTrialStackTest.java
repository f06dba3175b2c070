package com.aws.waftrial;

import software.amazon.awscdk.App;
import software.amazon.awscdk.CfnElement;
import software.amazon.awscdk.Environment;
import software.amazon.awscdk.assertions.Capture;
import software.amazon.awscdk.assertions.Match;
import software.amazon.awscdk.assertions.Template;
import software.amazon.awscdk.services.ec2.ISecurityGroup;
import software.constructs.IConstruct;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/* Unit testing for WafTrialStack, tests for key properties
 * in the cloudformation output of the stack.
 * Some empty maps and lists can be found to match
 * any value for fields in the Cloudformation output with
 * unimportant information.
 */
public class WafTrialStackTest {
    private static final String LISTENER = "AWS::ElasticLoadBalancingV2::Listener";
    private static final String TARGET_GROUP = "AWS::ElasticLoadBalancingV2::TargetGroup";
    private static final String INGRESS = "AWS::EC2::SecurityGroupIngress";

    private String region;
    private WafTrialStack stack;
    private Template template;

    public WafTrialStackTest() {
        App app = new App();

        region = "ap-northeast-1";

        stack = new WafTrialStack(app, "AwsWafTrialStack", WafTrialStackProps.builder()
            .env(makeEnv(System.getenv("CDK_DEFAULT_ACCOUNT"), region))
            .allowedIp("203.0.113.10/32")
            .build());

        template = Template.fromStack(stack);
    }

    @Test
    public void testNetwork() {
        template.hasResourceProperties("AWS::EC2::VPC", new HashMap<String, Object>() {{
            put("CidrBlock", "10.0.0.0/16");
            put("Tags", List.of(Map.of("Key", "Name", "Value", "wafTrialVPC")));
        }});

        template.resourceCountIs("AWS::EC2::Subnet", 2);
        template.resourceCountIs("AWS::EC2::NatGateway", 0);

        template.hasResourceProperties("AWS::EC2::Subnet", new HashMap<String, Object>() {{
            put("CidrBlock", "10.0.0.0/24");
            put("MapPublicIpOnLaunch", true);
        }});
    }

    @Test
    public void testWorkload() {
        //Cluster
        template.hasResourceProperties("AWS::ECS::Cluster", Map.of("ClusterName", "waf-trial-cluster"));

        //Task Definition
        template.hasResourceProperties("AWS::ECS::TaskDefinition", new HashMap<String, Object>() {{
            put("Cpu", "1024");
            put("Memory", "2048");
            put("NetworkMode", "awsvpc");
            put("RequiresCompatibilities", List.of("FARGATE"));
            put("ContainerDefinitions", List.of(Map.of(
                "Name", "WebgoatContainer",
                "Image", "webgoat/webgoat:v2023.8",
                "PortMappings", List.of(
                    Map.of("ContainerPort", 8080, "Protocol", "tcp"),
                    Map.of("ContainerPort", 9090, "Protocol", "tcp")),
                "LogConfiguration", Map.of("LogDriver", "awslogs"))));
        }});

        for (Map<String, String> variable : List.of(
                Map.of("Name", "WEBGOAT_HOST", "Value", "www.webgoat.local"),
                Map.of("Name", "WEBWOLF_HOST", "Value", "www.webwolf.local"))) {
            template.hasResourceProperties("AWS::ECS::TaskDefinition", Map.of("ContainerDefinitions",
                List.of(Map.of("Environment", Match.arrayWith(List.of(variable))))));
        }

        //LogGroup
        template.hasResourceProperties("AWS::Logs::LogGroup", Map.of("RetentionInDays", 1));

        //ECS Service
        template.hasResourceProperties("AWS::ECS::Service", new HashMap<String, Object>() {{
            put("DesiredCount", 1);
            put("LaunchType", "FARGATE");
            put("NetworkConfiguration", Map.of("AwsvpcConfiguration", Map.of("AssignPublicIp", "ENABLED")));
        }});
    }

    @Test
    public void testWebAclAssociation() {
        String webAclId = stack.getLogicalId(stack.getWebAcl().getWebAcl());

        template.resourceCountIs("AWS::WAFv2::WebACL", 1);
        template.resourceCountIs("AWS::WAFv2::WebACLAssociation", 1);

        template.hasResource("AWS::WAFv2::WebACLAssociation", new HashMap<String, Object>() {{
            put("Properties", Map.of(
                "ResourceArn", Map.of("Ref", logicalId(stack.getWafLoadBalancer())),
                "WebACLArn", Map.of("Fn::GetAtt", List.of(webAclId, "Arn"))));
            put("DependsOn", List.of(webAclId));
        }});
    }

    @Test
    public void testListeners() {
        String wafLb = logicalId(stack.getWafLoadBalancer());
        String rawLb = logicalId(stack.getRawLoadBalancer());

        template.resourceCountIs("AWS::ElasticLoadBalancingV2::LoadBalancer", 2);
        template.resourceCountIs(LISTENER, 3);
        template.resourceCountIs(TARGET_GROUP, 3);

        template.hasResourceProperties("AWS::ElasticLoadBalancingV2::LoadBalancer", Map.of(
            "Scheme", "internet-facing", "Type", "application"));

        Capture webWolfTarget = new Capture();
        template.hasResourceProperties(LISTENER, new HashMap<String, Object>() {{
            put("LoadBalancerArn", Map.of("Ref", wafLb));
            put("Port", 9090);
            put("Protocol", "HTTP");
            put("DefaultActions", List.of(Map.of("Type", "forward", "TargetGroupArn", Map.of("Ref", webWolfTarget))));
        }});

        Map<String, Object> webWolfGroup = properties(TARGET_GROUP, webWolfTarget.asString());
        assertEquals(9090, ((Number) webWolfGroup.get("Port")).intValue());
        assertEquals("/WebWolf", webWolfGroup.get("HealthCheckPath"));
        assertEquals(Map.of("HttpCode", "200-499"), webWolfGroup.get("Matcher"));
        assertEquals("ip", webWolfGroup.get("TargetType"));

        // the raw load balancer has no webwolf listener
        assertTrue(template.findResources(LISTENER, Map.of("Properties", Map.of(
            "LoadBalancerArn", Map.of("Ref", rawLb), "Port", 9090))).isEmpty());
    }

    @Test
    public void testEdgeParity() {
        Capture wafTarget = new Capture();
        Capture rawTarget = new Capture();
        Capture webWolfTarget = new Capture();

        template.hasResourceProperties(LISTENER, Map.of(
            "LoadBalancerArn", Map.of("Ref", logicalId(stack.getWafLoadBalancer())),
            "Port", 9090,
            "DefaultActions", List.of(Map.of("TargetGroupArn", Map.of("Ref", webWolfTarget)))));
        template.hasResourceProperties(LISTENER, Map.of(
            "LoadBalancerArn", Map.of("Ref", logicalId(stack.getWafLoadBalancer())),
            "Port", 80,
            "DefaultActions", List.of(Map.of("TargetGroupArn", Map.of("Ref", wafTarget)))));
        template.hasResourceProperties(LISTENER, Map.of(
            "LoadBalancerArn", Map.of("Ref", logicalId(stack.getRawLoadBalancer())),
            "Port", 80,
            "DefaultActions", List.of(Map.of("TargetGroupArn", Map.of("Ref", rawTarget)))));

        assertNotEquals(wafTarget.asString(), rawTarget.asString());

        Map<String, Object> wafGroup = properties(TARGET_GROUP, wafTarget.asString());
        Map<String, Object> rawGroup = properties(TARGET_GROUP, rawTarget.asString());
        assertEquals(wafGroup, rawGroup);
        assertEquals(8080, ((Number) wafGroup.get("Port")).intValue());
        assertEquals("/WebGoat", wafGroup.get("HealthCheckPath"));

        //Same service behind both, on the port each target group expects
        template.resourceCountIs("AWS::ECS::Service", 1);
        for (Map<String, Object> target : List.of(
                Map.<String, Object>of("ContainerName", "WebgoatContainer", "ContainerPort", 8080,
                    "TargetGroupArn", Map.of("Ref", wafTarget.asString())),
                Map.<String, Object>of("ContainerName", "WebgoatContainer", "ContainerPort", 9090,
                    "TargetGroupArn", Map.of("Ref", webWolfTarget.asString())),
                Map.<String, Object>of("ContainerName", "WebgoatContainer", "ContainerPort", 8080,
                    "TargetGroupArn", Map.of("Ref", rawTarget.asString())))) {
            template.hasResourceProperties("AWS::ECS::Service", Map.of("LoadBalancers",
                Match.arrayWith(List.of(target))));
        }
    }

    @Test
    public void testLoadBalancersOnlyAcceptBastion() {
        List<Map<String, Object>> wafRules = allIngress(securityGroupOf(stack.getWafLoadBalancer()
            .getConnections().getSecurityGroups()));
        List<Map<String, Object>> rawRules = allIngress(securityGroupOf(stack.getRawLoadBalancer()
            .getConnections().getSecurityGroups()));

        assertEquals(2, wafRules.size());
        assertEquals(1, rawRules.size());

        Set<Integer> wafPorts = new HashSet<>();
        for (Map<String, Object> rule : wafRules) {
            assertBastionPrefixList(rule);
            wafPorts.add(((Number) rule.get("FromPort")).intValue());
        }
        assertEquals(Set.of(80, 9090), wafPorts);

        assertBastionPrefixList(rawRules.get(0));
        assertEquals(80, ((Number) rawRules.get(0).get("FromPort")).intValue());
    }

    @Test
    public void testWorkloadIngress() {
        String serviceGroup = logicalId(stack.getWebGoat().getSecurityGroup());
        String wafGroup = securityGroupOf(stack.getWafLoadBalancer().getConnections().getSecurityGroups());
        String rawGroup = securityGroupOf(stack.getRawLoadBalancer().getConnections().getSecurityGroups());
        String bastionGroup = logicalId(stack.getBastion().getSecurityGroup());

        assertTrue(inlineIngress(serviceGroup).isEmpty());

        Map<String, Map<String, Object>> rules = template.findResources(INGRESS, Map.of("Properties",
            Map.of("GroupId", Map.of("Fn::GetAtt", List.of(serviceGroup, "GroupId")))));
        assertEquals(4, rules.size());

        Set<String> sources = new HashSet<>();
        Set<String> grants = new HashSet<>();
        for (Map<String, Object> rule : rules.values()) {
            @SuppressWarnings("unchecked")
            Map<String, Object> props = (Map<String, Object>) rule.get("Properties");
            @SuppressWarnings("unchecked")
            Map<String, Object> source = (Map<String, Object>) props.get("SourceSecurityGroupId");
            String sourceId = (String) ((List<?>) source.get("Fn::GetAtt")).get(0);
            sources.add(sourceId);

            String port = props.containsKey("FromPort")
                ? String.valueOf(((Number) props.get("FromPort")).intValue())
                : "all";
            grants.add(sourceId + ":" + props.get("IpProtocol") + ":" + port);
        }

        assertEquals(Set.of(wafGroup, rawGroup, bastionGroup), sources);
        assertEquals(Set.of(
            wafGroup + ":tcp:8080",
            wafGroup + ":tcp:9090",
            rawGroup + ":tcp:8080",
            bastionGroup + ":-1:all"), grants);
    }

    @Test
    public void testOutputs() {
        template.hasOutput("LoadBalancerWafDomainName", Map.of("Value",
            Map.of("Fn::GetAtt", List.of(logicalId(stack.getWafLoadBalancer()), "DNSName"))));
        template.hasOutput("LoadBalancerRawDomainName", Map.of("Value",
            Map.of("Fn::GetAtt", List.of(logicalId(stack.getRawLoadBalancer()), "DNSName"))));
        template.hasOutput("BastionServerEIP", Map.of("Value",
            Map.of("Ref", stack.getLogicalId(stack.getBastion().getEip()))));
    }

    private void assertBastionPrefixList(Map<String, Object> rule) {
        assertFalse(rule.containsKey("CidrIp"));
        @SuppressWarnings("unchecked")
        Map<String, Object> prefixList = (Map<String, Object>) rule.get("SourcePrefixListId");
        assertEquals("PrefixListId", ((List<?>) prefixList.get("Fn::GetAtt")).get(1));
    }

    // Rules can be rendered inline on the group or as separate resources
    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> allIngress(String securityGroupId) {
        List<Map<String, Object>> rules = new ArrayList<>(inlineIngress(securityGroupId));
        for (Map<String, Object> rule : template.findResources(INGRESS, Map.of("Properties",
                Map.of("GroupId", Map.of("Fn::GetAtt", List.of(securityGroupId, "GroupId"))))).values()) {
            rules.add((Map<String, Object>) rule.get("Properties"));
        }
        return rules;
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> inlineIngress(String securityGroupId) {
        Object rules = properties("AWS::EC2::SecurityGroup", securityGroupId).get("SecurityGroupIngress");
        return rules == null ? List.of() : (List<Map<String, Object>>) rules;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> properties(String type, String logicalId) {
        Map<String, Object> resource = template.findResources(type).get(logicalId);
        assertTrue(resource != null, "no " + type + " named " + logicalId);
        return (Map<String, Object>) resource.get("Properties");
    }

    private String securityGroupOf(List<ISecurityGroup> groups) {
        assertEquals(1, groups.size());
        return logicalId(groups.get(0));
    }

    private String logicalId(IConstruct construct) {
        return stack.getLogicalId((CfnElement) construct.getNode().getDefaultChild());
    }

    static Environment makeEnv(String account, String region) {
        return Environment.builder()
            .account(account)
            .region(region)
            .build();
    }
}
